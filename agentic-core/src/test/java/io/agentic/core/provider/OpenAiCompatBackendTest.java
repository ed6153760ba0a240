package io.agentic.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentic.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatBackendTest {

    private MockWebServer server;
    private OpenAiCompatBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        backend = new OpenAiCompatBackend(
            "openai",
            "sk-test",
            server.url("/v1").toString(),
            Duration.ofSeconds(10),
            Duration.ofSeconds(2)
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionResponse() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "role": "assistant", "content": "hi there" } }
                  ]
                }
                """));

        String reply = backend.chatOnce("gpt-5.2", List.of(ChatMessage.system("be brief"), ChatMessage.user("hello")));

        assertThat(reply).isEqualTo("hi there");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"gpt-5.2\"");
        assertThat(body).contains("\"stream\":false");
        assertThat(body).contains("{\"role\":\"system\",\"content\":\"be brief\"}");
        assertThat(body).contains("{\"role\":\"user\",\"content\":\"hello\"}");
        assertThat(body).doesNotContain("created_at");
    }

    @Test
    void shouldAccumulateSseBodyOnSyncCall() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"content":"hello "}}]}

                data: {"choices":[{"delta":{"content":"world"}}]}

                data: [DONE]

                """));

        assertThat(backend.chatOnce("gpt-5.2", List.of(ChatMessage.user("hi")))).isEqualTo("hello world");
    }

    @Test
    void shouldFailWhenNoChoicesReturned() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[]}"));

        assertThatThrownBy(() -> backend.chatOnce("gpt-5.2", List.of(ChatMessage.user("hi"))))
            .isInstanceOf(LlmBackendException.class)
            .hasMessageContaining("no choices");
    }

    @Test
    void shouldExposeHttpStatusOfFailedCall() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"boom\"}"));

        assertThatThrownBy(() -> backend.chatOnce("gpt-5.2", List.of(ChatMessage.user("hi"))))
            .isInstanceOfSatisfying(LlmBackendException.class, e -> {
                assertThat(e.httpStatus()).isEqualTo(500);
                assertThat(e.getMessage()).contains("HTTP 500").contains("boom");
            });
    }

    @Test
    void shouldRejectCallsWithoutApiKey() {
        OpenAiCompatBackend keyless = new OpenAiCompatBackend("openai", "", server.url("/v1").toString());

        assertThatThrownBy(() -> keyless.chatOnce("gpt-5.2", List.of(ChatMessage.user("hi"))))
            .isInstanceOf(LlmBackendException.class)
            .hasMessageContaining("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldStreamDeltasThenDone() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"role":"assistant"}}]}

                data: {"choices":[{"delta":{"content":"hi"}}]}

                data: {"choices":[{"delta":{"content":" there"}}]}

                data: [DONE]

                """));

        List<StreamEvent> events = drain(backend.chatStream("gpt-5.2", List.of(ChatMessage.user("hello"))));

        assertThat(events).extracting(StreamEvent::type).containsExactly(
            StreamEvent.Type.DELTA,
            StreamEvent.Type.DELTA,
            StreamEvent.Type.DONE
        );
        assertThat(events.get(0).delta() + events.get(1).delta()).isEqualTo("hi there");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"stream\":true");
    }

    @Test
    void shouldEndStreamWithErrorOnProviderErrorChunk() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                data: {"choices":[{"delta":{"content":"partial"}}]}

                data: {"error":{"message":"rate limited"}}

                """));

        List<StreamEvent> events = drain(backend.chatStream("gpt-5.2", List.of(ChatMessage.user("hello"))));

        assertThat(events).extracting(StreamEvent::type).containsExactly(StreamEvent.Type.DELTA, StreamEvent.Type.ERROR);
        assertThat(events.get(1).error()).hasMessageContaining("rate limited");
    }

    @Test
    void shouldEndStreamWithErrorOnHttpFailure() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("unauthorized"));

        List<StreamEvent> events = drain(backend.chatStream("gpt-5.2", List.of(ChatMessage.user("hello"))));

        assertThat(events).hasSize(1);
        assertThat(events.get(0).type()).isEqualTo(StreamEvent.Type.ERROR);
        assertThat(events.get(0).error()).isInstanceOfSatisfying(
            LlmBackendException.class,
            e -> assertThat(e.httpStatus()).isEqualTo(401)
        );
    }

    @Test
    void shouldAbortSyncCallWhenCancelled() {
        server.enqueue(new MockResponse()
            .setHeadersDelay(5, TimeUnit.SECONDS)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"too late\"}}]}"));
        CancellationToken cancellation = new CancellationToken();
        ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
        try {
            canceller.schedule(cancellation::cancel, 200, TimeUnit.MILLISECONDS);
            long started = System.nanoTime();

            assertThatThrownBy(() -> backend.chatOnce("gpt-5.2", List.of(ChatMessage.user("hello")), cancellation))
                .isInstanceOf(LlmBackendException.class)
                .hasMessageContaining("canceled");
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
        } finally {
            canceller.shutdownNow();
        }
    }

    private static List<StreamEvent> drain(LlmStream stream) throws InterruptedException {
        List<StreamEvent> events = new ArrayList<>();
        try (stream) {
            while (true) {
                StreamEvent event = stream.next();
                events.add(event);
                if (event.isTerminal()) {
                    return events;
                }
            }
        }
    }
}
