package io.agentic.core.agent;

import io.agentic.core.model.ChatMessage;
import io.agentic.core.model.ChatResponse;
import io.agentic.core.provider.CancellationToken;
import io.agentic.core.provider.LlmBackend;
import io.agentic.core.provider.LlmBackendException;
import io.agentic.core.provider.LlmStream;
import io.agentic.core.session.ConversationStore;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one user message plus the stored transcript into a model reply.
 *
 * <p>Holds no per-request state and may be shared across threads. The {@code get} and {@code put}
 * of one turn are not atomic: concurrent turns on the same conversation resolve by
 * last-write-wins in the store.
 */
public final class ChatAgent {
    private static final Logger LOG = LoggerFactory.getLogger(ChatAgent.class);

    private final LlmBackend backend;
    private final ConversationStore store;
    private final AgentSettings settings;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public ChatAgent(LlmBackend backend, ConversationStore store, AgentSettings settings) {
        this(backend, store, settings, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public ChatAgent(
        LlmBackend backend,
        ConversationStore store,
        AgentSettings settings,
        Clock clock,
        Supplier<String> idGenerator
    ) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    public AgentSettings settings() {
        return settings;
    }

    /**
     * Generates a complete reply and stores the updated transcript. Nothing is stored when either
     * the backend or the store fails.
     */
    public ChatResponse reply(String conversationId, String userText) throws IOException {
        return reply(conversationId, userText, CancellationToken.none());
    }

    /**
     * As {@link #reply(String, String)}, aborting the backend call once {@code cancellation} fires.
     * A cancelled turn is never stored and ends in {@link TurnCancelledException}.
     */
    public ChatResponse reply(String conversationId, String userText, CancellationToken cancellation)
        throws IOException {
        Turn turn = prepare(conversationId, userText);
        if (cancellation.isCancelled()) {
            throw new TurnCancelledException(turn.conversationId());
        }
        String reply;
        try {
            reply = backend.chatOnce(settings.model(), turn.prompt(), cancellation);
        } catch (LlmBackendException e) {
            if (cancellation.isCancelled()) {
                throw new TurnCancelledException(turn.conversationId(), e);
            }
            throw e;
        }
        if (cancellation.isCancelled()) {
            LOG.debug("Dropping reply for conversation {}: caller is gone", turn.conversationId());
            throw new TurnCancelledException(turn.conversationId());
        }
        ChatMessage assistantMessage = ChatMessage.assistant(reply, clock.instant());

        List<ChatMessage> updated = new ArrayList<>(
            settings.retention() == HistoryRetention.UNBOUNDED ? turn.history() : turn.window()
        );
        updated.add(turn.userMessage());
        updated.add(assistantMessage);
        store.put(turn.conversationId(), updated);

        LOG.debug("Stored {} messages for conversation {}", updated.size(), turn.conversationId());
        return new ChatResponse(turn.conversationId(), reply, settings.model());
    }

    /**
     * Starts a streaming reply. Persisting the streamed turn is left to the caller, which is the
     * only party that sees every delta.
     */
    public StreamingReply replyStream(String conversationId, String userText) throws IOException {
        Turn turn = prepare(conversationId, userText);
        LlmStream events = backend.chatStream(settings.model(), turn.prompt());
        return new StreamingReply(turn.conversationId(), events);
    }

    /**
     * The last {@code maxHistory} messages of {@code history}, oldest first; empty when
     * {@code maxHistory <= 0}.
     */
    public static List<ChatMessage> tailWindow(List<ChatMessage> history, int maxHistory) {
        if (maxHistory <= 0) {
            return List.of();
        }
        if (history.size() <= maxHistory) {
            return List.copyOf(history);
        }
        return List.copyOf(history.subList(history.size() - maxHistory, history.size()));
    }

    private Turn prepare(String conversationId, String userText) throws IOException {
        String id = conversationId == null || conversationId.isBlank() ? idGenerator.get() : conversationId;
        List<ChatMessage> history = store.get(id).orElse(List.of());
        List<ChatMessage> window = tailWindow(history, settings.maxHistory());
        ChatMessage userMessage = ChatMessage.user(userText, clock.instant());

        List<ChatMessage> prompt = new ArrayList<>(window.size() + 2);
        if (!settings.systemPrompt().isBlank()) {
            prompt.add(ChatMessage.system(settings.systemPrompt()).withCreatedAt(clock.instant()));
        }
        prompt.addAll(window);
        prompt.add(userMessage);

        LOG.debug(
            "Conversation {}: {} stored messages, {} in window, model {} via {}",
            id,
            history.size(),
            window.size(),
            settings.model(),
            backend.name()
        );
        return new Turn(id, history, window, userMessage, List.copyOf(prompt));
    }

    private record Turn(
        String conversationId,
        List<ChatMessage> history,
        List<ChatMessage> window,
        ChatMessage userMessage,
        List<ChatMessage> prompt
    ) {
    }
}
