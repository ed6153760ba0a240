package io.agentic.core.session;

import io.agentic.core.model.ChatMessage;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryConversationStore implements ConversationStore {
    private final Map<String, List<ChatMessage>> conversations = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConversationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryConversationStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<List<ChatMessage>> get(String conversationId) {
        return Optional.ofNullable(conversations.get(Transcripts.requireId(conversationId)));
    }

    @Override
    public void put(String conversationId, List<ChatMessage> messages) {
        String id = Transcripts.requireId(conversationId);
        conversations.put(id, Transcripts.normalizeForWrite(messages, clock.instant()));
    }
}
