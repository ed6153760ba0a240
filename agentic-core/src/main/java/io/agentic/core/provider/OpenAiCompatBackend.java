package io.agentic.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentic.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for any provider exposing the OpenAI {@code /chat/completions} API.
 */
public final class OpenAiCompatBackend implements LlmBackend {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatBackend.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int STREAM_BUFFER = 64;
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final OkHttpClient streamingClient;
    private final ObjectMapper mapper;
    private final Duration streamIdleTimeout;
    private final ExecutorService producers;

    public OpenAiCompatBackend(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, Duration.ofSeconds(120), Duration.ofSeconds(60));
    }

    public OpenAiCompatBackend(
        String name,
        String apiKey,
        String apiBase,
        Duration requestTimeout,
        Duration streamIdleTimeout
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.streamIdleTimeout = Objects.requireNonNull(streamIdleTimeout, "streamIdleTimeout must not be null");
        OkHttpClient base = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.client = base.newBuilder()
            .readTimeout(Duration.ofSeconds(90))
            .callTimeout(Objects.requireNonNull(requestTimeout, "requestTimeout must not be null"))
            .build();
        this.streamingClient = base.newBuilder()
            .readTimeout(streamIdleTimeout)
            .build();
        this.mapper = new ObjectMapper();
        AtomicInteger threadIds = new AtomicInteger();
        this.producers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, name + "-stream-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String chatOnce(String model, List<ChatMessage> messages) throws LlmBackendException {
        return chatOnce(model, messages, CancellationToken.none());
    }

    @Override
    public String chatOnce(String model, List<ChatMessage> messages, CancellationToken cancellation)
        throws LlmBackendException {
        Request request = buildRequest(model, messages, false);
        Call call = client.newCall(request);
        cancellation.onCancel(call::cancel);
        try (Response response = call.execute()) {
            ensureSuccessful(response);
            ResponseBody body = response.body();
            if (body == null) {
                throw new LlmBackendException("provider " + name + " returned an empty body", response.code());
            }
            String contentType = response.header("Content-Type", "");
            if (contentType.contains("text/event-stream")) {
                StringBuilder content = new StringBuilder();
                readSse(body.source(), content::append);
                return content.toString();
            }
            return parseCompletion(body.string());
        } catch (LlmBackendException e) {
            throw e;
        } catch (IOException e) {
            if (call.isCanceled()) {
                throw new LlmBackendException("provider " + name + " call canceled", e);
            }
            throw new LlmBackendException("provider " + name + " call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmBackendException("provider " + name + " call interrupted", e);
        }
    }

    @Override
    public LlmStream chatStream(String model, List<ChatMessage> messages) throws LlmBackendException {
        Request request = buildRequest(model, messages, true);
        Call call = streamingClient.newCall(request);
        QueueLlmStream stream = new QueueLlmStream(STREAM_BUFFER, streamIdleTimeout);
        stream.onClose(call::cancel);
        producers.execute(() -> pump(call, stream));
        return stream;
    }

    private void pump(Call call, QueueLlmStream stream) {
        try (Response response = call.execute()) {
            ensureSuccessful(response);
            ResponseBody body = response.body();
            if (body == null) {
                stream.emit(StreamEvent.error(new LlmBackendException("provider " + name + " returned an empty body")));
                return;
            }
            readSse(body.source(), delta -> {
                if (!stream.emit(StreamEvent.delta(delta))) {
                    throw new StreamClosedException();
                }
            });
            stream.emit(StreamEvent.done());
        } catch (StreamClosedException e) {
            LOG.debug("Consumer closed stream from provider {}", name);
        } catch (LlmBackendException e) {
            emitQuietly(stream, StreamEvent.error(e));
        } catch (IOException e) {
            if (!stream.isClosed()) {
                emitQuietly(stream, StreamEvent.error(
                    new LlmBackendException("provider " + name + " stream failed: " + e.getMessage(), e)
                ));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stream.finish();
        }
    }

    private void emitQuietly(QueueLlmStream stream, StreamEvent event) {
        try {
            stream.emit(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Request buildRequest(String model, List<ChatMessage> messages, boolean stream) throws LlmBackendException {
        if (apiKey.isBlank()) {
            throw new LlmBackendException("missing API key for provider " + name);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("stream", stream);

        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (IOException e) {
            throw new LlmBackendException("failed to encode request for provider " + name, e);
        }

        return new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", stream ? "text/event-stream" : "application/json")
            .build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireValue());
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private void ensureSuccessful(Response response) throws IOException {
        if (response.isSuccessful()) {
            return;
        }
        String errorBody = response.body() == null ? "" : response.body().string();
        throw new LlmBackendException(
            "provider " + name + " returned HTTP " + response.code() + " " + truncate(errorBody),
            response.code()
        );
    }

    private String parseCompletion(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new LlmBackendException("provider " + name + " returned no choices");
        }
        return choices.path(0).path("message").path("content").asText("");
    }

    private void readSse(BufferedSource source, DeltaSink sink) throws IOException, InterruptedException {
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }

            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                return;
            }

            JsonNode event = mapper.readTree(payload);
            if (event.hasNonNull("error")) {
                JsonNode error = event.path("error");
                String message = error.isTextual() ? error.asText() : error.path("message").asText("unknown error");
                throw new LlmBackendException("provider " + name + " reported: " + message);
            }
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    String text = delta.path("content").asText("");
                    if (!text.isEmpty()) {
                        sink.accept(text);
                    }
                }
            }
        }
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_ERROR_BODY_CHARS) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }

    @FunctionalInterface
    private interface DeltaSink {
        void accept(String delta) throws InterruptedException;
    }

    private static final class StreamClosedException extends RuntimeException {
        private StreamClosedException() {
            super(null, null, false, false);
        }
    }
}
