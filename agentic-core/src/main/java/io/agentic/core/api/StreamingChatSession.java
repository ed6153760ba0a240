package io.agentic.core.api;

import io.agentic.core.model.ChatMessage;
import io.agentic.core.provider.CancellationToken;
import io.agentic.core.provider.LlmStream;
import io.agentic.core.provider.StreamEvent;
import io.agentic.core.session.ConversationStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays one backend stream to the client and commits the turn once the stream completed.
 *
 * <p>Frames: {@code meta} first, then {@code delta}s, then {@code error} on generation failure or
 * {@code warn} on a failed commit, and always {@code done} last. A write failure means the client
 * is gone: the backend stream is closed and nothing is persisted.
 */
final class StreamingChatSession {
    private static final Logger LOG = LoggerFactory.getLogger(StreamingChatSession.class);

    private final ConversationStore store;
    private final Clock clock;
    private final String conversationId;
    private final String userText;
    private final LlmStream events;
    private final SseEventWriter writer;
    private final CancellationToken cancellation;
    private final StringBuilder reply = new StringBuilder();
    private StreamState state = StreamState.OPEN;

    StreamingChatSession(
        ConversationStore store,
        Clock clock,
        String conversationId,
        String userText,
        LlmStream events,
        SseEventWriter writer,
        CancellationToken cancellation
    ) {
        this.store = store;
        this.clock = clock;
        this.conversationId = conversationId;
        this.userText = userText;
        this.events = events;
        this.writer = writer;
        this.cancellation = cancellation;
    }

    StreamState run() throws IOException, InterruptedException {
        try (LlmStream stream = events) {
            writer.send("meta", Map.of("conversationId", conversationId));
            state = StreamState.STREAMING;
            while (state == StreamState.STREAMING) {
                StreamEvent event = stream.next();
                switch (event.type()) {
                    case DELTA -> {
                        reply.append(event.delta());
                        writer.send("delta", Map.of("delta", event.delta()));
                    }
                    case DONE -> state = StreamState.DONE;
                    case ERROR -> {
                        state = StreamState.FAILED;
                        LOG.warn("Generation failed for conversation {}: {}", conversationId, describe(event.error()));
                        writer.send("error", Map.of("message", describe(event.error())));
                    }
                }
            }
        }

        if (cancellation.isCancelled()) {
            throw new IOException("client disconnected");
        }
        if (state == StreamState.DONE) {
            commitTurn();
        }
        writer.send("done", Map.of("ok", true));
        return state;
    }

    StreamState state() {
        return state;
    }

    private void commitTurn() throws IOException {
        try {
            List<ChatMessage> transcript = new ArrayList<>(store.get(conversationId).orElse(List.of()));
            Instant now = clock.instant();
            transcript.add(ChatMessage.user(userText, now));
            transcript.add(ChatMessage.assistant(reply.toString(), now));
            store.put(conversationId, transcript);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to persist streamed turn for conversation {}", conversationId, e);
            Map<String, Object> warning = new LinkedHashMap<>();
            warning.put("message", "persist_failed");
            warning.put("detail", describe(e));
            writer.send("warn", warning);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
