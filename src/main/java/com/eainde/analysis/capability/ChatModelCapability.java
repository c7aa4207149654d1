package com.eainde.analysis.capability;

import com.eainde.analysis.error.UpstreamCapabilityException;
import com.eainde.analysis.model.UsageCounters;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * {@link StructuredCapability} backed by a LangChain4j {@link ChatModel}.
 */
@Log4j2
@RequiredArgsConstructor
public class ChatModelCapability implements StructuredCapability {

    private final ChatModelProvider chatModels;
    private final CapabilityParameterMapper parameterMapper;
    private final CostCalculator costCalculator;

    @Override
    public CapabilityResponse invoke(CapabilityRequest request) {
        ChatModel chatModel = chatModels.forModel(request.modelId());
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(SystemMessage.from(request.systemPrompt()), UserMessage.from(request.userPrompt()))
                .parameters(parameterMapper.toRequestParameters(request))
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest);
        } catch (RuntimeException e) {
            log.warn("Capability call to {} failed: {}", request.modelId(), e.getMessage());
            throw new UpstreamCapabilityException("Capability call to " + request.modelId() + " failed: "
                    + e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null) {
            throw new UpstreamCapabilityException("Capability " + request.modelId() + " returned no message");
        }

        UsageCounters usage = usage(request.modelId(), response.tokenUsage());
        log.info("Capability {} answered with {} characters, {} tokens, ${}",
                request.modelId(), response.aiMessage().text() == null ? 0 : response.aiMessage().text().length(),
                usage.totalTokens(), String.format("%.6f", usage.costUsd()));
        return new CapabilityResponse(response.aiMessage().text(), usage);
    }

    private UsageCounters usage(String modelId, TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return UsageCounters.ZERO;
        }
        long prompt = count(tokenUsage.inputTokenCount());
        long completion = count(tokenUsage.outputTokenCount());
        Integer total = tokenUsage.totalTokenCount();
        return costCalculator.usage(modelId, prompt, completion, total == null ? prompt + completion : total);
    }

    private static long count(Integer value) {
        return value == null ? 0 : value;
    }
}
