package io.agentic.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a conversation. {@code createdAt} may be {@code null} for a message that has not
 * been stamped yet; stores backfill it on write.
 */
public record ChatMessage(
    MessageRole role,
    String content,
    @JsonProperty("created_at") Instant createdAt
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null);
    }

    public static ChatMessage user(String content, Instant createdAt) {
        return new ChatMessage(MessageRole.USER, content, createdAt);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null);
    }

    public static ChatMessage assistant(String content, Instant createdAt) {
        return new ChatMessage(MessageRole.ASSISTANT, content, createdAt);
    }

    public ChatMessage withCreatedAt(Instant timestamp) {
        return new ChatMessage(role, content, timestamp);
    }
}
