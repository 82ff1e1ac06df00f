package com.solstream.producer.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solstream.producer.config.FeedSettings;
import com.solstream.producer.model.UpdateEnvelope;
import com.solstream.producer.subscription.SubscriptionRequest;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Geyser updates streamed as JSON text frames over a WebSocket. The subscription request is
 * sent as the first frame after the handshake. Frames are handed to {@link #next()} through a
 * small bounded buffer, so a slow reader stalls the socket instead of buffering without limit.
 * There is no reconnect: a closed socket is the end of the stream.
 */
public class WebSocketUpdateSource extends WebSocketClient implements UpdateSource {

    private static final Logger log = LoggerFactory.getLogger(WebSocketUpdateSource.class);

    static final int  INBOX_CAPACITY     = 1024;
    private static final long CONNECT_TIMEOUT_S = 10;
    private static final long POLL_MS           = 200;

    private final ObjectMapper         mapper;
    private final UpdateDecoder        decoder;
    private final long                 maxMessageBytes;
    private final BlockingQueue<Item>  inbox = new ArrayBlockingQueue<>(INBOX_CAPACITY);
    private volatile boolean           ended = false;

    public WebSocketUpdateSource(FeedSettings settings, ObjectMapper mapper) {
        super(URI.create(settings.endpoint));
        this.mapper          = mapper;
        this.decoder         = new UpdateDecoder(mapper);
        this.maxMessageBytes = settings.maxDecodingMessageSize;
        if (settings.xToken != null && !settings.xToken.isEmpty()) {
            addHeader("x-token", settings.xToken);
        }
    }

    @Override
    public void subscribe(SubscriptionRequest request) throws IOException, InterruptedException {
        if (!connectBlocking(CONNECT_TIMEOUT_S, TimeUnit.SECONDS)) {
            throw new IOException("could not connect to " + getURI());
        }
        String json;
        try {
            json = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IOException("cannot serialize subscription request", e);
        }
        send(json);
        log.info("ws.subscribed uri={} bytes={}", getURI(), json.length());
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        log.info("ws.connected uri={} status={}", getURI(), handshake.getHttpStatus());
    }

    @Override
    public void onMessage(String raw) {
        Item item;
        if (exceedsLimit(raw)) {
            item = Item.error(new TransportException("message exceeds max decoding size " + maxMessageBytes));
        } else {
            try {
                item = Item.update(decoder.decode(raw));
            } catch (TransportException e) {
                item = Item.error(e);
            }
        }
        try {
            inbox.put(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ws.handoff_interrupted");
        }
    }

    @Override
    public void onMessage(ByteBuffer bytes) {
        onMessage(StandardCharsets.UTF_8.decode(bytes).toString());
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        log.info("ws.closed code={} reason={} remote={}", code, reason, remote);
        ended = true;
    }

    @Override
    public void onError(Exception e) {
        log.error("ws.error error={}", e.getMessage());
    }

    @Override
    public UpdateEnvelope next() throws TransportException, InterruptedException {
        while (true) {
            Item item = inbox.poll(POLL_MS, TimeUnit.MILLISECONDS);
            if (item != null) {
                if (item.error != null) throw item.error;
                return item.update;
            }
            if (ended && inbox.isEmpty()) return null;
        }
    }

    private boolean exceedsLimit(String raw) {
        if (maxMessageBytes <= 0) return false;
        if (raw.length() > maxMessageBytes) return true;
        if ((long) raw.length() * 3 <= maxMessageBytes) return false;
        return raw.getBytes(StandardCharsets.UTF_8).length > maxMessageBytes;
    }

    private static final class Item {
        final UpdateEnvelope     update;
        final TransportException error;

        private Item(UpdateEnvelope update, TransportException error) {
            this.update = update;
            this.error  = error;
        }

        static Item update(UpdateEnvelope update)     { return new Item(update, null); }
        static Item error(TransportException error)   { return new Item(null, error); }
    }
}
