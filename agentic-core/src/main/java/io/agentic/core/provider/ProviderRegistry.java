package io.agentic.core.provider;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ProviderRegistry {
    private final Map<String, LlmBackend> backends = new ConcurrentHashMap<>();

    public void register(LlmBackend backend) {
        backends.put(normalize(backend.name()), backend);
    }

    public Optional<LlmBackend> find(String name) {
        return Optional.ofNullable(backends.get(normalize(name)));
    }

    public LlmBackend resolve(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + name));
    }

    private String normalize(String name) {
        return name == null ? "" : name.toLowerCase().replace('-', '_');
    }
}
