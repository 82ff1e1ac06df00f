package com.solstream.producer.subscription;

public class ConfigException extends Exception {

    public enum Kind { IO, PARSE_SYNTAX, INVALID_FILTER_SYNTAX }

    private final Kind   kind;
    private final String category;

    private ConfigException(Kind kind, String category, String message, Throwable cause) {
        super(message, cause);
        this.kind     = kind;
        this.category = category;
    }

    public static ConfigException io(String message, Throwable cause) {
        return new ConfigException(Kind.IO, null, message, cause);
    }

    public static ConfigException parseSyntax(String message, Throwable cause) {
        return new ConfigException(Kind.PARSE_SYNTAX, null, message, cause);
    }

    public static ConfigException invalidFilter(String category, String detail) {
        return new ConfigException(Kind.INVALID_FILTER_SYNTAX, category,
                "invalid " + category + " filter: " + detail, null);
    }

    public Kind kind() { return kind; }

    public String category() { return category; }
}
