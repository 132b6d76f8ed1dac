package com.example.flowmutator.llm;

import com.example.flowmutator.domain.WorkflowGraph;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * {@link ChangeProposalClient} backed by a langchain4j {@link ChatModel}.
 * <p>
 * The model is built on first use. Each request is retried up to {@code maxAttempts} times
 * with a fixed delay; a failed call and a blank reply both count as a failed attempt.
 * </p>
 */
public class LlmChangeProposalClient implements ChangeProposalClient {

    private static final Logger log = LoggerFactory.getLogger(LlmChangeProposalClient.class);

    private final OpenRouterChatModelFactory chatModelFactory;
    private final ModificationPromptBuilder promptBuilder;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final Double temperature;
    private final Integer maxTokens;
    private volatile ChatModel chatModel;

    public LlmChangeProposalClient(OpenRouterChatModelFactory chatModelFactory,
                                   ModificationPromptBuilder promptBuilder,
                                   int maxAttempts,
                                   long retryDelayMs,
                                   Double temperature,
                                   Integer maxTokens) {
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.retryDelayMs = Math.max(retryDelayMs, 0L);
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String proposeChanges(WorkflowGraph graph, String description) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(
                        SystemMessage.from(ModificationPromptBuilder.SYSTEM_PROMPT),
                        UserMessage.from(promptBuilder.build(graph, description))))
                .build();
        ChatModel model = chatModel();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ChatResponse response = model.chat(request);
                String reply = response.aiMessage() != null ? response.aiMessage().text() : null;
                if (reply != null && !reply.isBlank()) {
                    log.info("Generation succeeded attempt={} replyLength={}", attempt, reply.length());
                    return reply;
                }
                lastFailure = new GenerationFailedException("Generation backend returned an empty reply");
                log.warn("Generation returned empty reply attempt={} maxAttempts={}", attempt, maxAttempts);
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Generation failed attempt={} maxAttempts={} error={}", attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                pause();
            }
        }
        throw new GenerationFailedException("Generation failed after " + maxAttempts + " attempt(s)", lastFailure);
    }

    private ChatModel chatModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                model = chatModel;
                if (model == null) {
                    try {
                        model = chatModelFactory.build(null, null, temperature, maxTokens);
                    } catch (IllegalStateException e) {
                        throw new GenerationFailedException("Generation backend is not configured", e);
                    }
                    chatModel = model;
                }
            }
        }
        return model;
    }

    private void pause() {
        if (retryDelayMs == 0) {
            return;
        }
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException("Interrupted while waiting to retry generation", e);
        }
    }
}
