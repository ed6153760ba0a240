package io.agentic.core.provider;

import java.util.Objects;

public record StreamEvent(Type type, String delta, Throwable error) {

    public enum Type {
        DELTA,
        DONE,
        ERROR
    }

    public StreamEvent {
        Objects.requireNonNull(type, "type must not be null");
        if (type == Type.DELTA && (delta == null || delta.isEmpty())) {
            throw new IllegalArgumentException("delta events must carry text");
        }
        if (type == Type.ERROR) {
            Objects.requireNonNull(error, "error events must carry a cause");
        }
    }

    public static StreamEvent delta(String text) {
        return new StreamEvent(Type.DELTA, text, null);
    }

    public static StreamEvent done() {
        return new StreamEvent(Type.DONE, null, null);
    }

    public static StreamEvent error(Throwable cause) {
        return new StreamEvent(Type.ERROR, null, cause);
    }

    public boolean isTerminal() {
        return type != Type.DELTA;
    }
}
