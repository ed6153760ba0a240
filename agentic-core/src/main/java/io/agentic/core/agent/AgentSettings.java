package io.agentic.core.agent;

public record AgentSettings(
    String systemPrompt,
    String model,
    int maxHistory,
    HistoryRetention retention
) {
    public AgentSettings {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        maxHistory = Math.max(0, maxHistory);
        retention = retention == null ? HistoryRetention.BOUNDED : retention;
    }

    public AgentSettings(String systemPrompt, String model, int maxHistory) {
        this(systemPrompt, model, maxHistory, HistoryRetention.BOUNDED);
    }
}
