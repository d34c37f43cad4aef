package io.engram.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.engram.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FallbackLlmProviderTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() {
        LlmProvider primary = new StubProvider("primary", "Error calling LLM: timeout");
        LlmProvider secondary = new StubProvider("secondary", "ok");

        FallbackLlmProvider provider = new FallbackLlmProvider("chain", List.of(primary, secondary));

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")));

        assertThat(response.content()).isEqualTo("ok");
    }

    @Test
    void shouldReturnLastErrorWhenEveryProviderFails() {
        FallbackLlmProvider provider = new FallbackLlmProvider("chain", List.of(
            new DisabledProvider("openrouter", "no api key"),
            new StubProvider("openai", "Error calling LLM: HTTP 500")
        ));

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")));

        assertThat(response.failed()).isTrue();
        assertThat(response.content()).contains("HTTP 500");
    }

    private record StubProvider(String name, String content) implements LlmProvider {
        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages) {
            return new LlmResponse(content, Map.of());
        }
    }
}
