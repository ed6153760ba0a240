package io.agentic.core.agent;

import java.io.IOException;

/**
 * The caller went away before the turn finished; nothing was stored.
 */
public class TurnCancelledException extends IOException {
    private final String conversationId;

    public TurnCancelledException(String conversationId) {
        super("turn for conversation " + conversationId + " was cancelled");
        this.conversationId = conversationId;
    }

    public TurnCancelledException(String conversationId, Throwable cause) {
        super("turn for conversation " + conversationId + " was cancelled", cause);
        this.conversationId = conversationId;
    }

    public String conversationId() {
        return conversationId;
    }
}
