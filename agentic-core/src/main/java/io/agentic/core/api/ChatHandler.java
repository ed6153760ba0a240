package io.agentic.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentic.core.agent.ChatAgent;
import io.agentic.core.agent.StreamingReply;
import io.agentic.core.agent.TurnCancelledException;
import io.agentic.core.model.ChatRequest;
import io.agentic.core.model.ChatResponse;
import io.agentic.core.provider.LlmBackendException;
import io.agentic.core.session.ConversationStore;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /v1/chat} and {@code POST /v1/chat/stream}. Both must run on a worker thread.
 */
final class ChatHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ChatHandler.class);
    static final int MAX_BODY_BYTES = 1 << 20;
    private static final HttpString CACHE_CONTROL = new HttpString("Cache-Control");
    private static final HttpString CONNECTION = new HttpString("Connection");
    private static final Duration DISCONNECT_POLL_INTERVAL = Duration.ofMillis(50);

    private final ChatAgent agent;
    private final ConversationStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ScheduledExecutorService disconnectPoller;

    ChatHandler(
        ChatAgent agent,
        ConversationStore store,
        ObjectMapper mapper,
        Clock clock,
        ScheduledExecutorService disconnectPoller
    ) {
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = mapper;
        this.clock = clock;
        this.disconnectPoller = Objects.requireNonNull(disconnectPoller, "disconnectPoller must not be null");
    }

    void handleChat(HttpServerExchange exchange) throws IOException {
        if (!requirePost(exchange)) {
            return;
        }
        ChatRequest request = readRequest(exchange);
        if (request == null) {
            return;
        }

        ChatResponse response;
        try (ClientDisconnectWatch watch = ClientDisconnectWatch.start(exchange, disconnectPoller, DISCONNECT_POLL_INTERVAL)) {
            response = agent.reply(request.conversationId(), request.message(), watch.cancellation());
        } catch (TurnCancelledException e) {
            LOG.info("Client left before the reply for conversation {}; nothing stored", e.conversationId());
            exchange.endExchange();
            return;
        } catch (IOException e) {
            logFailure("Chat reply failed", e);
            JsonResponses.error(exchange, mapper, 502, failureCode(e), e.getMessage());
            return;
        }
        JsonResponses.send(exchange, mapper, 200, response);
    }

    void handleChatStream(HttpServerExchange exchange) throws IOException {
        if (!requirePost(exchange)) {
            return;
        }
        ChatRequest request = readRequest(exchange);
        if (request == null) {
            return;
        }

        ClientDisconnectWatch watch = ClientDisconnectWatch.start(exchange, disconnectPoller, DISCONNECT_POLL_INTERVAL);
        StreamingReply streaming;
        try {
            streaming = agent.replyStream(request.conversationId(), request.message());
        } catch (IOException e) {
            watch.close();
            logFailure("Chat stream could not start", e);
            JsonResponses.error(exchange, mapper, 502, failureCode(e), e.getMessage());
            return;
        } catch (RuntimeException e) {
            watch.close();
            throw e;
        }
        watch.cancellation().onCancel(streaming.events()::close);

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().put(CACHE_CONTROL, "no-cache, no-transform");
        exchange.getResponseHeaders().put(CONNECTION, "keep-alive");

        StreamingChatSession session = new StreamingChatSession(
            store,
            clock,
            streaming.conversationId(),
            request.message(),
            streaming.events(),
            new SseEventWriter(exchange.getOutputStream(), mapper),
            watch.cancellation()
        );
        try {
            StreamState finalState = session.run();
            LOG.debug("Stream for conversation {} ended in state {}", streaming.conversationId(), finalState);
        } catch (IOException e) {
            LOG.info(
                "Client left stream for conversation {} in state {}: {}",
                streaming.conversationId(),
                session.state(),
                e.getMessage()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Stream for conversation {} interrupted", streaming.conversationId());
        } finally {
            watch.close();
            streaming.events().close();
        }
        exchange.endExchange();
    }

    private boolean requirePost(HttpServerExchange exchange) throws IOException {
        if ("POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            return true;
        }
        JsonResponses.error(exchange, mapper, 405, "method_not_allowed", null);
        return false;
    }

    /**
     * Reads and validates the request body; answers 400 and returns {@code null} when it is unusable.
     */
    private ChatRequest readRequest(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] body;
        try (InputStream in = exchange.getInputStream()) {
            body = in.readNBytes(MAX_BODY_BYTES + 1);
        }
        if (body.length > MAX_BODY_BYTES) {
            JsonResponses.error(exchange, mapper, 400, "body_too_large", "request body exceeds " + MAX_BODY_BYTES + " bytes");
            return null;
        }
        if (body.length == 0) {
            JsonResponses.error(exchange, mapper, 400, "invalid_json", "request body is required");
            return null;
        }

        ChatRequest parsed;
        try {
            parsed = mapper.readValue(body, ChatRequest.class);
        } catch (JsonProcessingException e) {
            JsonResponses.error(exchange, mapper, 400, "invalid_json", e.getOriginalMessage());
            return null;
        }
        if (parsed == null) {
            JsonResponses.error(exchange, mapper, 400, "invalid_json", "request body must be a JSON object");
            return null;
        }

        String message = parsed.message() == null ? "" : parsed.message().trim();
        if (message.isEmpty()) {
            JsonResponses.error(exchange, mapper, 400, "message_required", "message is required");
            return null;
        }
        return new ChatRequest(parsed.conversationId(), message);
    }

    private static String failureCode(IOException e) {
        return e instanceof LlmBackendException ? "backend_error" : "store_error";
    }

    private static void logFailure(String message, IOException e) {
        if (e instanceof LlmBackendException backendError) {
            LOG.warn("{}: backend error (status {}): {}", message, backendError.httpStatus(), e.getMessage());
        } else {
            LOG.warn("{}: store error", message, e);
        }
    }
}
