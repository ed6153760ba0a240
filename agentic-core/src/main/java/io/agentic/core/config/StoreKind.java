package io.agentic.core.config;

import java.util.Locale;

public enum StoreKind {
    MEMORY,
    FILE,
    SQLITE;

    static StoreKind parse(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown CHAT_STORE: " + raw, e);
        }
    }
}
