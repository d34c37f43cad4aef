package io.engram.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.engram.core.error.EmbeddingException;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls an OpenAI-compatible {@code /embeddings} endpoint. Transient failures (429, 5xx, I/O) are
 * retried a bounded number of times before an {@link EmbeddingException} is raised.
 */
public final class OpenAiEmbeddingService implements EmbeddingService {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiEmbeddingService.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final int dimension;
    private final int maxAttempts;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiEmbeddingService(String apiKey, String apiBase, String model, int dimension, int maxAttempts) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.dimension = dimension;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(60))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public List<Double> embed(String text) {
        if (apiKey.isBlank()) {
            throw new EmbeddingException("missing API key for embedding endpoint " + apiBase);
        }

        long delayMs = 250;
        String lastError = "exhausted retries";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = client.newCall(buildRequest(text)).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (response.isSuccessful()) {
                    return parse(body);
                }
                lastError = "HTTP " + response.code() + " " + body;
                if (response.code() != 429 && response.code() < 500) {
                    break;
                }
            } catch (IOException ioe) {
                lastError = String.valueOf(ioe.getMessage());
            }
            if (attempt < maxAttempts) {
                LOG.debug("Embedding attempt {} failed: {}", attempt, lastError);
                sleep(delayMs);
                delayMs = Math.min(delayMs * 2, 2000);
            }
        }
        throw new EmbeddingException("Embedding request failed: " + lastError);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private Request buildRequest(String text) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", text == null ? "" : text);
        if (dimension > 0) {
            payload.put("dimensions", dimension);
        }
        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .build();
    }

    private List<Double> parse(String body) throws IOException {
        JsonNode vectorNode = mapper.readTree(body).path("data").path(0).path("embedding");
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new EmbeddingException("Embedding response carried no vector");
        }
        List<Double> vector = new ArrayList<>(vectorNode.size());
        for (JsonNode value : vectorNode) {
            vector.add(value.asDouble());
        }
        if (dimension > 0 && vector.size() != dimension) {
            throw new EmbeddingException("Expected " + dimension + " dimensions but got " + vector.size());
        }
        return vector;
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
