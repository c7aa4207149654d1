package com.eainde.analysis.capability;

import com.eainde.analysis.error.SchemaValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Lenient reader of model output: strips markdown fences and surrounding prose, then parses the outermost
 * JSON object. Anything that still does not parse is a {@link SchemaValidationException}.
 */
public class JsonResponseParser {

    private static final int PREVIEW = 200;

    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parse(String response) {
        if (response == null || response.isBlank()) {
            throw new SchemaValidationException("Empty response received");
        }
        String candidate = stripFences(response.trim());

        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0) {
            throw new SchemaValidationException("No JSON object found. Response preview: " + preview(candidate));
        }
        if (end <= start) {
            throw new SchemaValidationException("Response appears truncated, no closing brace found. Response ends with: "
                    + tail(candidate));
        }
        String json = candidate.substring(start, end + 1);
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new SchemaValidationException("Response is not a JSON object: " + preview(json));
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String stripFences(String response) {
        int fence = response.indexOf("```");
        if (fence < 0) {
            return response;
        }
        int contentStart = response.indexOf('\n', fence);
        if (contentStart < 0) {
            return response;
        }
        int closing = response.indexOf("```", contentStart);
        return closing > contentStart ? response.substring(contentStart + 1, closing).trim() : response.substring(contentStart + 1);
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW ? text : text.substring(0, PREVIEW) + "...";
    }

    private static String tail(String text) {
        return text.length() <= PREVIEW ? text : "..." + text.substring(text.length() - PREVIEW);
    }
}
