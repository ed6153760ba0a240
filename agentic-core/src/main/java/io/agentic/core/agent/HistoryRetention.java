package io.agentic.core.agent;

import java.util.Locale;

/**
 * What the agent writes back after a turn: only the tail window used for the prompt
 * ({@link #BOUNDED}) or the whole stored history ({@link #UNBOUNDED}).
 */
public enum HistoryRetention {
    BOUNDED,
    UNBOUNDED;

    public static HistoryRetention parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BOUNDED;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown history retention: " + raw, e);
        }
    }
}
