package com.eainde.analysis.capability;

import com.eainde.analysis.schema.ResponseSchema;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;

/**
 * Maps a {@link CapabilityRequest} and the configured sampling settings onto LangChain4j request parameters.
 */
public class CapabilityParameterMapper {

    private final Double temperature;
    private final Integer maxOutputTokens;
    private final boolean jsonSchemaMode;

    public CapabilityParameterMapper(Double temperature, Integer maxOutputTokens, boolean jsonSchemaMode) {
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
        this.jsonSchemaMode = jsonSchemaMode;
    }

    public ChatRequestParameters toRequestParameters(CapabilityRequest request) {
        DefaultChatRequestParameters.Builder<?> builder = ChatRequestParameters.builder();

        if (request.modelId() != null) {
            builder.modelName(request.modelId());
        }
        if (maxOutputTokens != null) {
            builder.maxOutputTokens(maxOutputTokens);
        }
        if (temperature != null) {
            builder.temperature(temperature);
        }

        // JSON mode always; the schema itself only when the provider is trusted with it
        builder.responseFormat(responseFormat(request.schema()));

        return builder.build();
    }

    private ResponseFormat responseFormat(ResponseSchema schema) {
        if (jsonSchemaMode && schema != null) {
            return ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(schema.langChainSchema())
                    .build();
        }
        return ResponseFormat.builder()
                .type(ResponseFormatType.JSON)
                .build();
    }
}
