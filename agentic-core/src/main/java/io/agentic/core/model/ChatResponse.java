package io.agentic.core.model;

public record ChatResponse(String conversationId, String reply, String model) {
}
