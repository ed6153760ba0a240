package io.agentic.core.provider;

import io.agentic.core.model.ChatMessage;
import java.util.List;

public interface LlmBackend {
    String name();

    /**
     * Generates the complete reply for {@code messages}, which already include any system message.
     */
    String chatOnce(String model, List<ChatMessage> messages) throws LlmBackendException;

    /**
     * Same as {@link #chatOnce(String, List)}, but the backend should abort the call once
     * {@code cancellation} fires. Backends that cannot abort simply finish the call.
     */
    default String chatOnce(String model, List<ChatMessage> messages, CancellationToken cancellation)
        throws LlmBackendException {
        return chatOnce(model, messages);
    }

    /**
     * Starts an incremental reply. Failures after the call has started are delivered as an
     * {@link StreamEvent.Type#ERROR} event rather than thrown. Closing the stream aborts the call.
     */
    LlmStream chatStream(String model, List<ChatMessage> messages) throws LlmBackendException;
}
