package io.agentic.core.config;

import io.agentic.core.agent.HistoryRetention;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public record AgenticConfig(
    String host,
    int port,
    String provider,
    String apiKey,
    String apiBase,
    String model,
    String systemPrompt,
    int maxHistory,
    HistoryRetention retention,
    StoreKind store,
    Path storePath,
    Duration requestTimeout,
    Duration streamIdleTimeout
) {
    public static final String DEFAULT_SYSTEM_PROMPT = """
        You are a helpful assistant. Be concise, correct, and practical.
        If the user asks for code, provide production-grade code with clear structure.""";

    public static AgenticConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static AgenticConfig fromEnv(Map<String, String> env) {
        String[] address = splitAddress(env(env, "HTTP_ADDR", ":8080"));
        String provider = env(env, "CHAT_PROVIDER", "openai").toLowerCase(Locale.ROOT);
        String apiKey = env(env, "OPENAI_API_KEY", "");
        if (!"openai".equals(provider) && !"echo".equals(provider)) {
            throw new IllegalStateException("Unknown CHAT_PROVIDER: " + provider);
        }
        if ("openai".equals(provider) && apiKey.isBlank()) {
            throw new IllegalStateException("OPENAI_API_KEY is required");
        }

        StoreKind store = StoreKind.parse(env(env, "CHAT_STORE", "memory"));
        HistoryRetention retention;
        try {
            retention = HistoryRetention.parse(env(env, "CHAT_HISTORY_RETENTION", "bounded"));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }

        return new AgenticConfig(
            address[0],
            parsePort(address[1]),
            provider,
            apiKey,
            env(env, "OPENAI_API_BASE", "https://api.openai.com/v1"),
            env(env, "OPENAI_MODEL", "gpt-5.2"),
            env(env, "CHAT_SYSTEM_PROMPT", DEFAULT_SYSTEM_PROMPT),
            Math.max(0, intEnv(env, "CHAT_MAX_HISTORY", 20)),
            retention,
            store,
            resolveStorePath(env.get("CHAT_STORE_PATH"), store),
            Duration.ofSeconds(Math.max(1, intEnv(env, "CHAT_REQUEST_TIMEOUT_SECONDS", 120))),
            Duration.ofSeconds(Math.max(1, intEnv(env, "CHAT_STREAM_IDLE_TIMEOUT_SECONDS", 60)))
        );
    }

    private static String[] splitAddress(String raw) {
        int idx = raw.lastIndexOf(':');
        if (idx < 0) {
            return new String[] {"0.0.0.0", raw};
        }
        String host = raw.substring(0, idx).trim();
        return new String[] {host.isEmpty() ? "0.0.0.0" : host, raw.substring(idx + 1)};
    }

    private static int parsePort(String raw) {
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 0 || port > 65_535) {
                throw new IllegalStateException("HTTP_ADDR port out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid HTTP_ADDR port: " + raw, e);
        }
    }

    private static Path resolveStorePath(String raw, StoreKind store) {
        if (raw == null || raw.isBlank()) {
            String fileName = store == StoreKind.SQLITE ? "conversations.db" : "conversations.json";
            return Path.of(System.getProperty("user.home"), ".agentic", fileName);
        }
        if (raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(raw.substring(2));
        }
        return Path.of(raw);
    }

    private static String env(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
