package com.solstream.producer.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricsSettings {

    public static final String DEFAULT_ENDPOINT = "https://in.logs.betterstack.com/metrics";
    public static final long   DEFAULT_INTERVAL_S = 10;

    @JsonProperty("enabled")   public Boolean enabled;
    @JsonProperty("api_token") public String  apiToken;
    @JsonProperty("endpoint")  public String  endpoint;
    @JsonProperty("interval")  public Long    interval;

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public String apiTokenOrDefault() {
        return apiToken == null ? "" : apiToken;
    }

    public String endpointOrDefault() {
        return endpoint == null ? DEFAULT_ENDPOINT : endpoint;
    }

    public long intervalOrDefault() {
        return interval == null ? DEFAULT_INTERVAL_S : interval;
    }
}
