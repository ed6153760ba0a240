package io.agentic.core.provider;

import io.agentic.core.model.ChatMessage;
import io.agentic.core.model.MessageRole;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic local backend: replies with the last user message. Streams the same reply split
 * on word boundaries.
 */
public final class EchoBackend implements LlmBackend {
    private final String name;
    private final Duration idleTimeout;

    public EchoBackend(String name) {
        this(name, Duration.ofSeconds(5));
    }

    public EchoBackend(String name, Duration idleTimeout) {
        this.name = name;
        this.idleTimeout = idleTimeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String chatOnce(String model, List<ChatMessage> messages) {
        String lastUserMessage = messages.stream()
            .filter(message -> message.role() == MessageRole.USER)
            .reduce((first, second) -> second)
            .map(ChatMessage::content)
            .orElse("");
        return "echo: " + lastUserMessage;
    }

    @Override
    public LlmStream chatStream(String model, List<ChatMessage> messages) {
        List<StreamEvent> events = new ArrayList<>();
        for (String piece : splitKeepingSpaces(chatOnce(model, messages))) {
            events.add(StreamEvent.delta(piece));
        }
        events.add(StreamEvent.done());
        return QueueLlmStream.completed(events, idleTimeout);
    }

    static List<String> splitKeepingSpaces(String text) {
        List<String> pieces = new ArrayList<>();
        int start = 0;
        for (int i = 1; i < text.length(); i++) {
            if (text.charAt(i) == ' ') {
                pieces.add(text.substring(start, i));
                start = i;
            }
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }
}
