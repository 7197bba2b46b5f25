package io.unitledger.core.feed;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/** Frame exchanged on the audit feed; {@code payload} is a plain JSON object. */
public record FeedMessage(String type, Map<String, Object> payload) {
    public static final String SUBSCRIBE = "subscribe";
    public static final String ENTRY = "entry";
    public static final String CAUGHT_UP = "caught_up";
    public static final String HEARTBEAT = "heartbeat";
    public static final String ERROR = "error";

    public FeedMessage {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(payload);
    }

    public static FeedMessage subscribe(long fromSequence) {
        return new FeedMessage(SUBSCRIBE, Map.of("fromSequence", fromSequence));
    }

    public static FeedMessage caughtUp(long nextSequence) {
        return new FeedMessage(CAUGHT_UP, Map.of("nextSequence", nextSequence));
    }

    public static FeedMessage heartbeat(long nextSequence) {
        return new FeedMessage(HEARTBEAT, Map.of("nextSequence", nextSequence));
    }

    public static FeedMessage error(String message) {
        return new FeedMessage(ERROR, Map.of("message", message == null ? "error" : message));
    }

    /** Numeric payload field, or {@code fallback} when absent or not a number. */
    public long longField(String name, long fallback) {
        Object value = payload.get(name);
        return value instanceof Number n ? n.longValue() : fallback;
    }
}
