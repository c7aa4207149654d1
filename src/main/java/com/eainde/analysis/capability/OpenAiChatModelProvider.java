package com.eainde.analysis.capability;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link OpenAiChatModel} per model id against an OpenAI-compatible endpoint, built on first use.
 */
@Log4j2
public class OpenAiChatModelProvider implements ChatModelProvider {

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public OpenAiChatModelProvider(String baseUrl, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public ChatModel forModel(String modelId) {
        return models.computeIfAbsent(modelId, this::build);
    }

    private ChatModel build(String modelId) {
        log.info("Creating chat model client for {} at {}", modelId, baseUrl);
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelId)
                .timeout(timeout)
                .build();
    }
}
