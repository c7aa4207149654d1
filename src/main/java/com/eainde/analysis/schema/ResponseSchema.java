package com.eainde.analysis.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * A response contract in both forms: the raw JSON Schema used for validation and the LangChain4j
 * schema sent to the model.
 */
public record ResponseSchema(String name, JsonNode definition, JsonSchema langChainSchema) {
}
