package com.jobprospector.hiring.detection.llm;

public interface LlmCompletionClient {
    String complete(String prompt, double temperature, int maxTokens);

    boolean isAvailable();

    String providerLabel();
}
