package io.agentic.core.session;

import io.agentic.core.model.ChatMessage;
import io.agentic.core.model.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class Transcripts {

    private Transcripts() {
    }

    static String requireId(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId must not be blank");
        }
        return conversationId;
    }

    static List<ChatMessage> normalizeForWrite(List<ChatMessage> messages, Instant now) {
        Objects.requireNonNull(messages, "messages must not be null");
        List<ChatMessage> normalized = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            Objects.requireNonNull(message, "messages must not contain null entries");
            if (message.role() == MessageRole.SYSTEM) {
                throw new IllegalArgumentException("system messages are never persisted");
            }
            normalized.add(message.createdAt() == null ? message.withCreatedAt(now) : message);
        }
        return List.copyOf(normalized);
    }
}
