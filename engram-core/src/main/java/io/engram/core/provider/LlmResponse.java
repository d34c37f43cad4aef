package io.engram.core.provider;

import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    static final String ERROR_PREFIX = "Error calling LLM:";

    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmResponse error(String detail) {
        return new LlmResponse(ERROR_PREFIX + " " + detail, Map.of());
    }

    public boolean failed() {
        return content.startsWith(ERROR_PREFIX);
    }
}
