package com.example.flowmutator.config;

import com.example.flowmutator.diff.WorkflowDiffer;
import com.example.flowmutator.diff.WorkflowHasher;
import com.example.flowmutator.domain.WorkflowGraphCodec;
import com.example.flowmutator.llm.ChangeProposalClient;
import com.example.flowmutator.llm.LlmChangeProposalClient;
import com.example.flowmutator.llm.ModificationPromptBuilder;
import com.example.flowmutator.llm.OpenRouterChatModelFactory;
import com.example.flowmutator.mutation.WorkflowMutator;
import com.example.flowmutator.validation.HeuristicNodeClassifier;
import com.example.flowmutator.validation.NodeClassifier;
import com.example.flowmutator.validation.WorkflowGraphValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public WorkflowMutator workflowMutator() {
        return new WorkflowMutator();
    }

    @Bean
    public NodeClassifier nodeClassifier() {
        return new HeuristicNodeClassifier();
    }

    @Bean
    public WorkflowGraphValidator workflowGraphValidator(
            NodeClassifier nodeClassifier,
            @Value("${flow-mutator.validation.strict:false}") boolean strict) {
        return new WorkflowGraphValidator(nodeClassifier, strict);
    }

    @Bean
    public WorkflowDiffer workflowDiffer(
            WorkflowGraphCodec codec,
            WorkflowHasher hasher,
            @Value("${flow-mutator.diff.cache-size:100}") int cacheSize,
            @Value("${flow-mutator.diff.move-threshold:100.0}") double moveThreshold) {
        return new WorkflowDiffer(codec, hasher, cacheSize, moveThreshold);
    }

    @Bean
    public ChangeProposalClient changeProposalClient(
            OpenRouterChatModelFactory chatModelFactory,
            ModificationPromptBuilder promptBuilder,
            @Value("${flow-mutator.generation.max-attempts:3}") int maxAttempts,
            @Value("${flow-mutator.generation.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${flow-mutator.generation.temperature:#{null}}") Double temperature,
            @Value("${flow-mutator.generation.max-tokens:#{null}}") Integer maxTokens) {
        return new LlmChangeProposalClient(chatModelFactory, promptBuilder, maxAttempts, retryDelayMs, temperature, maxTokens);
    }
}
