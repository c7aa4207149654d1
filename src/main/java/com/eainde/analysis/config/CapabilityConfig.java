package com.eainde.analysis.config;

import com.eainde.analysis.capability.CapabilityModel;
import com.eainde.analysis.capability.CapabilityModel.ModelDefaults;
import com.eainde.analysis.capability.CapabilityParameterMapper;
import com.eainde.analysis.capability.CapabilityRole;
import com.eainde.analysis.capability.ChatModelCapability;
import com.eainde.analysis.capability.ChatModelProvider;
import com.eainde.analysis.capability.CostCalculator;
import com.eainde.analysis.capability.JsonResponseParser;
import com.eainde.analysis.capability.OpenAiChatModelProvider;
import com.eainde.analysis.capability.StructuredCapability;
import com.eainde.analysis.schema.ResponseSchemas;
import com.eainde.analysis.schema.SchemaValidator;
import com.eainde.analysis.stage.PromptCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The model-facing side: chat model clients, request mapping, response contracts and prompts.
 */
@Log4j2
@Configuration
public class CapabilityConfig {

    @Bean
    public ModelDefaults modelDefaults(AnalysisProperties properties) {
        AnalysisProperties.Capability capability = properties.getCapability();
        ModelDefaults defaults = new ModelDefaults(capability.getDefaultExtractionModel(),
                capability.getDefaultAnalysisModel());
        // fail at startup on a default outside the supported set
        CapabilityModel.resolve(null, CapabilityRole.EXTRACTION, defaults);
        CapabilityModel.resolve(null, CapabilityRole.ANALYSIS, defaults);
        return defaults;
    }

    @Bean
    public ChatModelProvider chatModelProvider(AnalysisProperties properties) {
        AnalysisProperties.Capability capability = properties.getCapability();
        if (capability.getApiKey() == null || capability.getApiKey().isBlank()) {
            log.warn("analysis.capability.api-key is not set, capability calls will be rejected upstream");
        }
        return new OpenAiChatModelProvider(capability.getBaseUrl(), capability.getApiKey(),
                properties.getPipeline().getStageTimeout());
    }

    @Bean
    public CostCalculator costCalculator(ObjectMapper objectMapper) {
        return new CostCalculator(objectMapper);
    }

    @Bean
    public StructuredCapability structuredCapability(ChatModelProvider chatModelProvider,
                                                     AnalysisProperties properties,
                                                     CostCalculator costCalculator) {
        AnalysisProperties.Capability capability = properties.getCapability();
        CapabilityParameterMapper mapper = new CapabilityParameterMapper(capability.getTemperature(),
                capability.getMaxOutputTokens(), capability.isJsonSchemaMode());
        return new ChatModelCapability(chatModelProvider, mapper, costCalculator);
    }

    @Bean
    public ResponseSchemas responseSchemas(ObjectMapper objectMapper) {
        return new ResponseSchemas(objectMapper);
    }

    @Bean
    public SchemaValidator schemaValidator() {
        return new SchemaValidator();
    }

    @Bean
    public JsonResponseParser jsonResponseParser(ObjectMapper objectMapper) {
        return new JsonResponseParser(objectMapper);
    }

    @Bean
    public PromptCatalog promptCatalog(ObjectMapper objectMapper) {
        return new PromptCatalog(objectMapper);
    }
}
