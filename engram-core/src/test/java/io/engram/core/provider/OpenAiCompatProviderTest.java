package io.engram.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
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
                    { "message": { "content": "hello from json" } }
                  ],
                  "usage": { "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/v1").toString(),
            Map.of("X-App", "engram")
        );

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isFalse();
        assertThat(response.content()).isEqualTo("hello from json");
        assertThat(response.usage()).containsEntry("total_tokens", 42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-App")).isEqualTo("engram");
        assertThat(request.getBody().readUtf8()).contains("\"stream\":false");
    }

    @Test
    void shouldRetryServerErrorsThenSucceed() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"recovered\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 2);

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.content()).isEqualTo("recovered");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldReportClientErrorsWithoutRetrying() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("bad key"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 3);

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("HTTP 401").contains("bad key");
        assertThat(response.usage()).containsEntry("http_status", 401);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldFailFastWithoutApiKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "", server.url("/v1").toString(), Map.of());

        LlmResponse response = provider.chat("gpt-4o-mini", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isTrue();
        assertThat(server.getRequestCount()).isZero();
    }
}
