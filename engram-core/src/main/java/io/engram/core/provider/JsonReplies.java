package io.engram.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON object a model was asked to answer with, tolerating markdown code fences and
 * prose around the object.
 */
public final class JsonReplies {

    private JsonReplies() {
    }

    public static JsonNode parseObject(ObjectMapper mapper, String reply) throws IOException {
        String text = reply == null ? "" : reply.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            int fence = text.lastIndexOf("```");
            if (fence >= 0) {
                text = text.substring(0, fence);
            }
        }
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open < 0 || close < open) {
            throw new IOException("reply does not contain a JSON object");
        }
        JsonNode node = mapper.readTree(text.substring(open, close + 1));
        if (!node.isObject()) {
            throw new IOException("reply is not a JSON object");
        }
        return node;
    }

    public static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            String value = item.isTextual() ? item.asText() : item.toString();
            if (!value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }
}
