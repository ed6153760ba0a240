package io.agentic.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;

final class JsonResponses {

    private JsonResponses() {
    }

    static void send(HttpServerExchange exchange, ObjectMapper mapper, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    static void error(HttpServerExchange exchange, ObjectMapper mapper, int status, String code, String message)
        throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code);
        if (message != null && !message.isBlank()) {
            payload.put("message", message);
        }
        send(exchange, mapper, status, payload);
    }
}
