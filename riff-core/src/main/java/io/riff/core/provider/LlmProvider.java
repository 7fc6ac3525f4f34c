package io.riff.core.provider;

import io.riff.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;

public interface LlmProvider {
    String name();

    DeltaStream stream(GenerationRequest request) throws IOException;

    String complete(String model, List<ChatMessage> messages) throws IOException;
}
