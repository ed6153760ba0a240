package io.agentic.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

public record ChatRequest(
    @JsonAlias({"conversation_id"}) String conversationId,
    String message
) {
}
