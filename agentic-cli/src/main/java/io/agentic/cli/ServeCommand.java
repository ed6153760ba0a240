package io.agentic.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the HTTP chat gateway and block until shutdown")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Bind address (defaults to HTTP_ADDR)")
    String host;

    @Option(names = {"--port"}, description = "Listen port (defaults to HTTP_ADDR)")
    Integer port;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.gatewayRunner().run(
                host != null ? host : context.defaultHost(),
                port != null ? port : context.defaultPort()
            );
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
