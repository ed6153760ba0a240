package io.agentic.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.agentic.core.agent.ChatAgent;
import io.agentic.core.session.ConversationStore;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the agent: {@code /v1/chat}, {@code /v1/chat/stream} and {@code /healthz}.
 * Every request is handled on its own worker thread.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    static final HttpString REQUEST_ID = new HttpString("X-Request-Id");

    private final String host;
    private final int requestedPort;
    private final ObjectMapper mapper;
    private final ChatHandler chatHandler;
    private final ExecutorService executor;
    private final ScheduledExecutorService disconnectPoller;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, ChatAgent agent, ConversationStore store) {
        this(port, host, agent, store, Clock.systemUTC());
    }

    public GatewayServer(int port, String host, ChatAgent agent, ConversationStore store, Clock clock) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.disconnectPoller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "gateway-disconnect-watch");
            thread.setDaemon(true);
            return thread;
        });
        this.chatHandler = new ChatHandler(agent, store, mapper, clock, disconnectPoller);
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gateway-request-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/v1/chat", chatHandler::handleChat)
            .addExactPath("/v1/chat/stream", chatHandler::handleChatStream)
            .addPrefixPath("/", this::handleNotFound);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> exchange.dispatch(executor, () -> handleTracked(routes, exchange)))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
        executor.shutdownNow();
        disconnectPoller.shutdownNow();
    }

    private void handleTracked(PathHandler routes, HttpServerExchange exchange) {
        String incoming = exchange.getRequestHeaders().getFirst(REQUEST_ID);
        String requestId = incoming == null || incoming.isBlank() ? UUID.randomUUID().toString() : incoming.trim();
        exchange.getResponseHeaders().put(REQUEST_ID, requestId);
        long startedNanos = System.nanoTime();
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();
        exchange.addExchangeCompleteListener((completed, next) -> {
            LOG.info(
                "http_request request_id={} method={} path={} status={} latency_ms={}",
                requestId,
                method,
                path,
                completed.getStatusCode(),
                (System.nanoTime() - startedNanos) / 1_000_000
            );
            next.proceed();
        });

        RequestContext.setRequestId(requestId);
        try {
            routes.handleRequest(exchange);
        } catch (Exception e) {
            LOG.error("Unhandled failure on {} {}", method, path, e);
            sendInternalError(exchange);
        } finally {
            RequestContext.clear();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            JsonResponses.error(exchange, mapper, 405, "method_not_allowed", null);
            return;
        }
        JsonResponses.send(exchange, mapper, 200, Map.of("status", "ok"));
    }

    private void handleNotFound(HttpServerExchange exchange) throws IOException {
        JsonResponses.error(exchange, mapper, 404, "not_found", null);
    }

    private void sendInternalError(HttpServerExchange exchange) {
        if (exchange.isResponseStarted()) {
            exchange.endExchange();
            return;
        }
        try {
            JsonResponses.error(exchange, mapper, 500, "internal_error", null);
        } catch (IOException e) {
            LOG.debug("Could not report internal error: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }
}
