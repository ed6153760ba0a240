package io.agentic.app;

import io.agentic.cli.AgenticCliCommand;
import io.agentic.cli.ChatCommand;
import io.agentic.cli.CliContext;
import io.agentic.cli.ServeCommand;
import io.agentic.core.agent.AgentSettings;
import io.agentic.core.agent.ChatAgent;
import io.agentic.core.api.GatewayServer;
import io.agentic.core.config.AgenticConfig;
import io.agentic.core.provider.EchoBackend;
import io.agentic.core.provider.LlmBackend;
import io.agentic.core.provider.OpenAiCompatBackend;
import io.agentic.core.provider.ProviderRegistry;
import io.agentic.core.session.ConversationStore;
import io.agentic.core.session.FileConversationStore;
import io.agentic.core.session.InMemoryConversationStore;
import io.agentic.core.session.SqliteConversationStore;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class AgenticApplication {
    private static final Logger LOG = LoggerFactory.getLogger(AgenticApplication.class);

    private AgenticApplication() {
    }

    public static void main(String[] args) {
        AgenticConfig config;
        ConversationStore conversationStore;
        try {
            config = AgenticConfig.fromEnv();
            conversationStore = buildConversationStore(config);
        } catch (IllegalStateException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }

        LlmBackend backend = buildBackend(config);
        ChatAgent agent = new ChatAgent(
            backend,
            conversationStore,
            new AgentSettings(config.systemPrompt(), config.model(), config.maxHistory(), config.retention())
        );

        CliContext context = new CliContext(
            agent,
            config.host(),
            config.port(),
            (host, port) -> runGateway(host, port, agent, conversationStore)
        );

        CommandLine commandLine = new CommandLine(new AgenticCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static ConversationStore buildConversationStore(AgenticConfig config) {
        switch (config.store()) {
            case SQLITE:
                try {
                    return new SqliteConversationStore(config.storePath());
                } catch (Exception e) {
                    throw new IllegalStateException(
                        "Failed to initialize SQLite conversation store at " + config.storePath(),
                        e
                    );
                }
            case FILE:
                return new FileConversationStore(config.storePath());
            case MEMORY:
            default:
                return new InMemoryConversationStore();
        }
    }

    static LlmBackend buildBackend(AgenticConfig config) {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new EchoBackend("echo", config.streamIdleTimeout()));
        registry.register(new OpenAiCompatBackend(
            "openai",
            config.apiKey(),
            config.apiBase(),
            config.requestTimeout(),
            config.streamIdleTimeout()
        ));
        return registry.resolve(config.provider());
    }

    private static int runGateway(String host, int port, ChatAgent agent, ConversationStore store) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(port, host, agent, store)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            LOG.info(
                "Serving model {} with {} history retention ({})",
                agent.settings().model(),
                agent.settings().retention().name().toLowerCase(),
                store.getClass().getSimpleName()
            );
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: POST /v1/chat, POST /v1/chat/stream, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
