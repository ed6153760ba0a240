package io.agentic.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes named server-sent-event frames ({@code event: <name>} then {@code data: <json>}) and
 * flushes each one immediately.
 */
final class SseEventWriter {
    private final OutputStream out;
    private final ObjectMapper mapper;

    SseEventWriter(OutputStream out, ObjectMapper mapper) {
        this.out = out;
        this.mapper = mapper;
    }

    void send(String event, Object payload) throws IOException {
        String frame = "event: " + event + "\n"
            + "data: " + mapper.writeValueAsString(payload) + "\n\n";
        out.write(frame.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
