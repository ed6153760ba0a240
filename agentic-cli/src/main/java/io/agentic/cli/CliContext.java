package io.agentic.cli;

import io.agentic.core.agent.ChatAgent;

public record CliContext(ChatAgent agent, String defaultHost, int defaultPort, GatewayRunner gatewayRunner) {
    public CliContext(ChatAgent agent) {
        this(agent, "0.0.0.0", 8080, (host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
