package io.agentic.core.agent;

import io.agentic.core.provider.LlmStream;

/**
 * A started streaming reply. The caller owns {@code events} and must close it.
 */
public record StreamingReply(String conversationId, LlmStream events) {
}
