package com.example.flowmutator.llm;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Test double: always returns the same {@link ChatModel} regardless of baseUrl/modelName.
 */
public class StubOpenRouterChatModelFactory extends OpenRouterChatModelFactory {

    private final ChatModel stub;

    public StubOpenRouterChatModelFactory(ChatModel stub) {
        super("test-key", "https://test", "test-model", 5);
        this.stub = stub;
    }

    @Override
    public ChatModel build(String baseUrl, String modelName, Double temperature, Integer maxTokens) {
        return stub;
    }
}
