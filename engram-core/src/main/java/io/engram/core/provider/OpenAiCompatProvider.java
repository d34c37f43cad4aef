package io.engram.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.engram.core.model.ChatMessage;
import io.engram.core.model.MessageRole;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Non-streaming client for any {@code /chat/completions} endpoint (OpenRouter, OpenAI, local gateways).
 * Retries 429 and 5xx answers and I/O failures with capped exponential backoff.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages) {
        if (apiKey.isBlank()) {
            return LlmResponse.error("missing API key for provider " + name);
        }

        long delayMs = 250;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Request request = buildRequest(model, messages);
                try (Response response = client.newCall(request).execute()) {
                    if (!response.isSuccessful()) {
                        String errorBody = response.body() == null ? "" : response.body().string();
                        boolean retryable = response.code() == 429 || response.code() >= 500;
                        if (retryable && attempt < maxAttempts) {
                            sleep(delayMs);
                            delayMs = Math.min(delayMs * 2, 2000);
                            continue;
                        }
                        return new LlmResponse(
                            LlmResponse.ERROR_PREFIX + " HTTP " + response.code() + " " + errorBody,
                            Map.of("http_status", response.code())
                        );
                    }

                    ResponseBody body = response.body();
                    if (body == null) {
                        return new LlmResponse("", Map.of());
                    }
                    return parseJson(body.string());
                }
            } catch (IOException ioe) {
                if (attempt < maxAttempts) {
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                return LlmResponse.error(String.valueOf(ioe.getMessage()));
            } catch (RuntimeException e) {
                return LlmResponse.error(String.valueOf(e.getMessage()));
            }
        }
        return LlmResponse.error("exhausted retries");
    }

    private Request buildRequest(String model, List<ChatMessage> messages) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("stream", false);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
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
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
        };
    }

    private LlmResponse parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        return new LlmResponse(content, usageAsMap(root.path("usage")));
    }

    private Map<String, Object> usageAsMap(JsonNode usage) {
        if (usage == null || usage.isMissingNode() || usage.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(usage, new TypeReference<Map<String, Object>>() {
        });
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
