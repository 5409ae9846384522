package com.jobprospector.hiring.detection.llm;

import com.jobprospector.hiring.config.HiringProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class LangChainCompletionClient implements LlmCompletionClient {
    private static final Logger log = LoggerFactory.getLogger(LangChainCompletionClient.class);

    private final ChatModel chatModel;
    private final LlmRateLimiter rateLimiter;
    private final String providerLabel;

    @Autowired
    public LangChainCompletionClient(HiringProperties properties, LlmRateLimiter rateLimiter) {
        this(buildChatModel(properties.getLlm()), rateLimiter, properties.getLlm().getProviderLabel());
        if (chatModel == null) {
            log.warn("No LLM API key configured (hiring.llm.api-key); page analysis is disabled");
        }
    }

    LangChainCompletionClient(ChatModel chatModel, LlmRateLimiter rateLimiter, String providerLabel) {
        this.chatModel = chatModel;
        this.rateLimiter = rateLimiter;
        this.providerLabel = providerLabel;
    }

    @Override
    public String complete(String prompt, double temperature, int maxTokens) {
        if (chatModel == null) {
            throw new LlmException("LLM not configured");
        }
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("interrupted while waiting for rate limiter", e);
        }
        ChatRequest request = ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .temperature(temperature)
            .maxOutputTokens(maxTokens)
            .build();
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new LlmException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
        AiMessage message = response == null ? null : response.aiMessage();
        if (message == null || message.text() == null) {
            throw new LlmException("empty completion");
        }
        return message.text();
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public String providerLabel() {
        return providerLabel;
    }

    static ChatModel buildChatModel(HiringProperties.Llm llm) {
        if (!llm.isConfigured()) {
            return null;
        }
        return OpenAiChatModel.builder()
            .baseUrl(llm.getBaseUrl())
            .apiKey(llm.getApiKey())
            .modelName(llm.getModelName())
            .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
            .build();
    }
}
