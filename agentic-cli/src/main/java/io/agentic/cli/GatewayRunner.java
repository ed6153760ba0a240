package io.agentic.cli;

@FunctionalInterface
public interface GatewayRunner {
    int run(String host, int port) throws Exception;
}
