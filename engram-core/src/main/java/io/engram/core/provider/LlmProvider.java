package io.engram.core.provider;

import io.engram.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse chat(String model, List<ChatMessage> messages);
}
