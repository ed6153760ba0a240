package io.agentic.core.session;

import io.agentic.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Maps a conversation id to its ordered transcript of user and assistant messages.
 *
 * <p>{@link #put} replaces the whole transcript; concurrent writers on the same id follow
 * last-write-wins. Implementations copy in both directions so neither side can observe the
 * other's mutations.
 */
public interface ConversationStore {

    /**
     * Returns the stored transcript, or {@link Optional#empty()} when the id has never been written.
     */
    Optional<List<ChatMessage>> get(String conversationId) throws IOException;

    /**
     * Replaces the transcript of {@code conversationId}. Messages without a timestamp are stamped
     * with one instant shared by the whole batch.
     *
     * @throws IllegalArgumentException when a message has the system role
     */
    void put(String conversationId, List<ChatMessage> messages) throws IOException;
}
