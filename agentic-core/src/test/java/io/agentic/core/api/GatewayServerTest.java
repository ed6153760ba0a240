package io.agentic.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentic.core.agent.AgentSettings;
import io.agentic.core.agent.ChatAgent;
import io.agentic.core.model.ChatMessage;
import io.agentic.core.provider.CancellationToken;
import io.agentic.core.provider.EchoBackend;
import io.agentic.core.provider.LlmBackend;
import io.agentic.core.provider.LlmBackendException;
import io.agentic.core.provider.LlmStream;
import io.agentic.core.provider.QueueLlmStream;
import io.agentic.core.provider.StreamEvent;
import io.agentic.core.session.ConversationStore;
import io.agentic.core.session.InMemoryConversationStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class GatewayServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    @Test
    void shouldReplyAndPersistOnSyncChat() throws Exception {
        InMemoryConversationStore store = new InMemoryConversationStore();
        try (GatewayServer server = server(new EchoBackend("echo"), store)) {
            HttpResponse<String> response = post(server, "/v1/chat", "{\"conversationId\":\"c1\",\"message\":\"  hello  \"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                value -> assertThat(value).startsWith("application/json")
            );
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("conversationId").asText()).isEqualTo("c1");
            assertThat(body.path("reply").asText()).isEqualTo("echo: hello");
            assertThat(body.path("model").asText()).isEqualTo("test-model");
            assertThat(store.get("c1").orElseThrow()).extracting(ChatMessage::content)
                .containsExactly("hello", "echo: hello");
        }
    }

    @Test
    void shouldMintConversationIdWhenAbsent() throws Exception {
        try (GatewayServer server = server(new EchoBackend("echo"), new InMemoryConversationStore())) {
            HttpResponse<String> response = post(server, "/v1/chat", "{\"message\":\"hi\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(response.body()).path("conversationId").asText()).isNotBlank();
        }
    }

    @Test
    void shouldRejectInvalidRequestsWithoutCallingBackendOrStore() throws Exception {
        CountingBackend backend = new CountingBackend();
        CountingStore store = new CountingStore();
        try (GatewayServer server = server(backend, store)) {
            for (String path : List.of("/v1/chat", "/v1/chat/stream")) {
                HttpResponse<String> blank = post(server, path, "{\"message\":\"   \"}");
                assertThat(blank.statusCode()).isEqualTo(400);
                assertThat(mapper.readTree(blank.body()).path("error").asText()).isEqualTo("message_required");

                HttpResponse<String> malformed = post(server, path, "{\"message\":");
                assertThat(malformed.statusCode()).isEqualTo(400);
                assertThat(mapper.readTree(malformed.body()).path("error").asText()).isEqualTo("invalid_json");

                HttpResponse<String> jsonNull = post(server, path, "null");
                assertThat(jsonNull.statusCode()).isEqualTo(400);
                assertThat(mapper.readTree(jsonNull.body()).path("error").asText()).isEqualTo("invalid_json");

                HttpResponse<String> unknownField = post(server, path, "{\"message\":\"hi\",\"temperature\":2}");
                assertThat(unknownField.statusCode()).isEqualTo(400);
            }

            HttpResponse<String> tooLarge = post(
                server,
                "/v1/chat",
                "{\"message\":\"" + "a".repeat(ChatHandler.MAX_BODY_BYTES) + "\"}"
            );
            assertThat(tooLarge.statusCode()).isEqualTo(400);
            assertThat(mapper.readTree(tooLarge.body()).path("error").asText()).isEqualTo("body_too_large");
        }
        assertThat(backend.calls).hasValue(0);
        assertThat(store.calls).hasValue(0);
    }

    @Test
    void shouldReturnBadGatewayWhenBackendFails() throws Exception {
        InMemoryConversationStore store = new InMemoryConversationStore();
        try (GatewayServer server = server(new FailingBackend(), store)) {
            HttpResponse<String> response = post(server, "/v1/chat", "{\"conversationId\":\"c1\",\"message\":\"hi\"}");

            assertThat(response.statusCode()).isEqualTo(502);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("error").asText()).isEqualTo("backend_error");
            assertThat(body.path("message").asText()).contains("upstream down");
            assertThat(store.get("c1")).isEmpty();
        }
    }

    @Test
    void shouldRejectWrongMethodAndUnknownPath() throws Exception {
        try (GatewayServer server = server(new EchoBackend("echo"), new InMemoryConversationStore())) {
            HttpResponse<String> wrongMethod = get(server, "/v1/chat");
            assertThat(wrongMethod.statusCode()).isEqualTo(405);

            HttpResponse<String> missing = get(server, "/v2/nothing");
            assertThat(missing.statusCode()).isEqualTo(404);
            assertThat(mapper.readTree(missing.body()).path("error").asText()).isEqualTo("not_found");
        }
    }

    @Test
    void shouldAnswerHealthCheckAndEchoRequestId() throws Exception {
        try (GatewayServer server = server(new EchoBackend("echo"), new InMemoryConversationStore())) {
            HttpRequest request = HttpRequest.newBuilder(uri(server, "/healthz"))
                .header("X-Request-Id", "req-42")
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(response.body()).path("status").asText()).isEqualTo("ok");
            assertThat(response.headers().firstValue("X-Request-Id")).hasValue("req-42");

            HttpResponse<String> generated = get(server, "/healthz");
            assertThat(generated.headers().firstValue("X-Request-Id")).hasValueSatisfying(
                value -> assertThat(value).isNotBlank()
            );
        }
    }

    @Test
    void shouldStreamMetaDeltasAndDoneThenPersist() throws Exception {
        InMemoryConversationStore store = new InMemoryConversationStore();
        try (GatewayServer server = server(new EchoBackend("echo"), store)) {
            HttpResponse<String> response = post(server, "/v1/chat/stream", "{\"conversationId\":\"s1\",\"message\":\"hello world\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                value -> assertThat(value).startsWith("text/event-stream")
            );
            assertThat(response.headers().firstValue("Cache-Control")).hasValue("no-cache, no-transform");

            List<Frame> frames = frames(response.body());
            assertThat(frames).extracting(Frame::event)
                .containsExactly("meta", "delta", "delta", "delta", "done");
            assertThat(frames.get(0).data().path("conversationId").asText()).isEqualTo("s1");
            StringBuilder text = new StringBuilder();
            frames.stream().filter(frame -> frame.event().equals("delta"))
                .forEach(frame -> text.append(frame.data().path("delta").asText()));
            assertThat(text.toString()).isEqualTo("echo: hello world");
            assertThat(frames.get(frames.size() - 1).data().path("ok").asBoolean()).isTrue();

            assertThat(store.get("s1").orElseThrow()).extracting(ChatMessage::content)
                .containsExactly("hello world", "echo: hello world");
        }
    }

    @Test
    void shouldSendErrorThenDoneWithoutPersistingWhenGenerationFails() throws Exception {
        InMemoryConversationStore store = new InMemoryConversationStore();
        LlmBackend partial = new StreamingOnlyBackend(List.of(
            StreamEvent.delta("par"),
            StreamEvent.error(new LlmBackendException("connection reset"))
        ));
        try (GatewayServer server = server(partial, store)) {
            HttpResponse<String> response = post(server, "/v1/chat/stream", "{\"conversationId\":\"s2\",\"message\":\"hi\"}");

            List<Frame> frames = frames(response.body());
            assertThat(frames).extracting(Frame::event).containsExactly("meta", "delta", "error", "done");
            assertThat(frames.get(2).data().path("message").asText()).contains("connection reset");
            assertThat(store.get("s2")).isEmpty();
        }
    }

    @Test
    void shouldReportSilentStreamEndAsError() throws Exception {
        InMemoryConversationStore store = new InMemoryConversationStore();
        LlmBackend silent = new StreamingOnlyBackend(List.of(StreamEvent.delta("cut")));
        try (GatewayServer server = server(silent, store)) {
            HttpResponse<String> response = post(server, "/v1/chat/stream", "{\"conversationId\":\"s3\",\"message\":\"hi\"}");

            assertThat(frames(response.body())).extracting(Frame::event).containsExactly("meta", "delta", "error", "done");
            assertThat(store.get("s3")).isEmpty();
        }
    }

    @Test
    void shouldWarnWhenStreamedTurnCannotBePersisted() throws Exception {
        ConversationStore readOnly = new ConversationStore() {
            @Override
            public Optional<List<ChatMessage>> get(String conversationId) {
                return Optional.empty();
            }

            @Override
            public void put(String conversationId, List<ChatMessage> messages) throws IOException {
                throw new IOException("read-only volume");
            }
        };
        try (GatewayServer server = server(new EchoBackend("echo"), readOnly)) {
            HttpResponse<String> response = post(server, "/v1/chat/stream", "{\"conversationId\":\"s4\",\"message\":\"hi\"}");

            List<Frame> frames = frames(response.body());
            assertThat(frames).extracting(Frame::event).containsExactly("meta", "delta", "delta", "warn", "done");
            Frame warn = frames.get(3);
            assertThat(warn.data().path("message").asText()).isEqualTo("persist_failed");
            assertThat(warn.data().path("detail").asText()).contains("read-only volume");
        }
    }

    @Test
    void shouldReturnBadGatewayWhenStreamCannotStart() throws Exception {
        try (GatewayServer server = server(new FailingBackend(), new InMemoryConversationStore())) {
            HttpResponse<String> response = post(server, "/v1/chat/stream", "{\"message\":\"hi\"}");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(mapper.readTree(response.body()).path("error").asText()).isEqualTo("backend_error");
        }
    }

    @Test
    void shouldHideFailureDetailFromInternalErrorBody() throws Exception {
        ConversationStore exploding = new ConversationStore() {
            @Override
            public Optional<List<ChatMessage>> get(String conversationId) {
                throw new IllegalStateException("secret detail at /var/lib/agentic");
            }

            @Override
            public void put(String conversationId, List<ChatMessage> messages) {
            }
        };
        try (GatewayServer server = server(new EchoBackend("echo"), exploding)) {
            for (String path : List.of("/v1/chat", "/v1/chat/stream")) {
                HttpResponse<String> response = post(server, path, "{\"conversationId\":\"c1\",\"message\":\"hi\"}");

                assertThat(response.statusCode()).isEqualTo(500);
                assertThat(mapper.readTree(response.body()).path("error").asText()).isEqualTo("internal_error");
                assertThat(response.body()).doesNotContain("secret detail");
            }
        }
    }

    @Test
    void shouldCancelBackendCallAndSkipPersistWhenSyncClientDisconnects() throws Exception {
        BlockingBackend backend = new BlockingBackend();
        InMemoryConversationStore store = new InMemoryConversationStore();
        try (GatewayServer server = server(backend, store)) {
            Socket socket = openPost(server, "/v1/chat", "{\"conversationId\":\"gone\",\"message\":\"hi\"}");
            assertThat(backend.entered.await(5, TimeUnit.SECONDS)).isTrue();

            socket.close();

            assertThat(backend.cancelled.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(backend.returned.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(300);
            assertThat(store.get("gone")).isEmpty();
        }
    }

    @Test
    void shouldCloseBackendStreamAndSkipPersistWhenStreamClientDisconnects() throws Exception {
        CountDownLatch streamClosed = new CountDownLatch(1);
        LlmBackend silent = new StreamingOnlyBackend(List.of()) {
            @Override
            public LlmStream chatStream(String model, List<ChatMessage> messages) {
                QueueLlmStream stream = new QueueLlmStream(4, Duration.ofSeconds(30));
                stream.onClose(streamClosed::countDown);
                return stream;
            }
        };
        InMemoryConversationStore store = new InMemoryConversationStore();
        try (GatewayServer server = server(silent, store)) {
            Socket socket = openPost(server, "/v1/chat/stream", "{\"conversationId\":\"gone\",\"message\":\"hi\"}");
            BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8)
            );
            String line;
            do {
                line = reader.readLine();
            } while (line != null && !line.equals("event: meta"));
            assertThat(line).isEqualTo("event: meta");

            socket.close();

            assertThat(streamClosed.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(300);
            assertThat(store.get("gone")).isEmpty();
        }
    }

    private GatewayServer server(LlmBackend backend, ConversationStore store) {
        ChatAgent agent = new ChatAgent(backend, store, new AgentSettings("Be helpful.", "test-model", 20));
        GatewayServer server = new GatewayServer(0, "127.0.0.1", agent, store);
        server.start();
        return server;
    }

    private HttpResponse<String> post(GatewayServer server, String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(server, path))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(GatewayServer server, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(server, path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static Socket openPost(GatewayServer server, String path, String json) throws IOException {
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        Socket socket = new Socket("127.0.0.1", server.port());
        socket.setSoTimeout(10_000);
        OutputStream out = socket.getOutputStream();
        String head = "POST " + path + " HTTP/1.1\r\n"
            + "Host: 127.0.0.1:" + server.port() + "\r\n"
            + "Content-Type: application/json\r\n"
            + "Content-Length: " + body.length + "\r\n"
            + "\r\n";
        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
        return socket;
    }

    private static URI uri(GatewayServer server, String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    private List<Frame> frames(String body) throws IOException {
        List<Frame> frames = new ArrayList<>();
        for (String block : body.split("\n\n")) {
            String event = null;
            String data = null;
            for (String line : block.split("\n")) {
                if (line.startsWith("event: ")) {
                    event = line.substring("event: ".length());
                } else if (line.startsWith("data: ")) {
                    data = line.substring("data: ".length());
                }
            }
            if (event != null) {
                frames.add(new Frame(event, mapper.readTree(data)));
            }
        }
        return frames;
    }

    private record Frame(String event, JsonNode data) {
    }

    private static final class CountingBackend implements LlmBackend {
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public String name() {
            return "counting";
        }

        @Override
        public String chatOnce(String model, List<ChatMessage> messages) {
            calls.incrementAndGet();
            return "counted";
        }

        @Override
        public LlmStream chatStream(String model, List<ChatMessage> messages) {
            calls.incrementAndGet();
            return QueueLlmStream.completed(List.of(StreamEvent.done()), Duration.ofSeconds(1));
        }
    }

    private static final class CountingStore implements ConversationStore {
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public Optional<List<ChatMessage>> get(String conversationId) {
            calls.incrementAndGet();
            return Optional.empty();
        }

        @Override
        public void put(String conversationId, List<ChatMessage> messages) {
            calls.incrementAndGet();
        }
    }

    private static final class FailingBackend implements LlmBackend {
        @Override
        public String name() {
            return "failing";
        }

        @Override
        public String chatOnce(String model, List<ChatMessage> messages) throws LlmBackendException {
            throw new LlmBackendException("upstream down", 503);
        }

        @Override
        public LlmStream chatStream(String model, List<ChatMessage> messages) throws LlmBackendException {
            throw new LlmBackendException("upstream down", 503);
        }
    }

    private static final class BlockingBackend implements LlmBackend {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch cancelled = new CountDownLatch(1);
        private final CountDownLatch returned = new CountDownLatch(1);

        @Override
        public String name() {
            return "blocking";
        }

        @Override
        public String chatOnce(String model, List<ChatMessage> messages) {
            return "late reply";
        }

        @Override
        public String chatOnce(String model, List<ChatMessage> messages, CancellationToken cancellation)
            throws LlmBackendException {
            cancellation.onCancel(cancelled::countDown);
            entered.countDown();
            try {
                cancelled.await(10, TimeUnit.SECONDS);
                return "late reply";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmBackendException("interrupted", e);
            } finally {
                returned.countDown();
            }
        }

        @Override
        public LlmStream chatStream(String model, List<ChatMessage> messages) throws LlmBackendException {
            throw new LlmBackendException("sync only");
        }
    }

    private static class StreamingOnlyBackend implements LlmBackend {
        private final List<StreamEvent> events;

        private StreamingOnlyBackend(List<StreamEvent> events) {
            this.events = events;
        }

        @Override
        public String name() {
            return "scripted-stream";
        }

        @Override
        public String chatOnce(String model, List<ChatMessage> messages) throws LlmBackendException {
            throw new LlmBackendException("streaming only");
        }

        @Override
        public LlmStream chatStream(String model, List<ChatMessage> messages) {
            return QueueLlmStream.completed(events, Duration.ofSeconds(1));
        }
    }
}
