package com.eainde.analysis.capability;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The model ids a caller may choose for either capability call. {@link #AUTO} resolves to the configured
 * default of the role, so a cache key never contains {@code auto}.
 */
public enum CapabilityModel {
    AUTO("auto"),
    GPT_4O_MINI("openai/gpt-4o-mini"),
    GPT_4O("openai/gpt-4o"),
    GPT_4_1("openai/gpt-4.1"),
    GEMINI_3_PRO_PREVIEW("google/gemini-3-pro-preview"),
    GEMINI_3_FLASH_PREVIEW("google/gemini-3-flash-preview");

    private final String id;

    CapabilityModel(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @param id a model id, {@code auto}, or blank for {@code auto}
     * @throws IllegalArgumentException for an id outside the supported set
     */
    public static CapabilityModel fromId(String id) {
        if (id == null || id.isBlank()) {
            return AUTO;
        }
        String candidate = id.trim();
        return Arrays.stream(values())
                .filter(model -> model.id.equalsIgnoreCase(candidate))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported model '" + id + "', expected one of "
                        + Arrays.stream(values()).map(CapabilityModel::id).collect(Collectors.joining(", "))));
    }

    /**
     * Resolves a caller's choice to a concrete model id.
     */
    public static String resolve(String choice, CapabilityRole role, ModelDefaults defaults) {
        CapabilityModel model = fromId(choice);
        if (model != AUTO) {
            return model.id;
        }
        String fallback = role == CapabilityRole.EXTRACTION ? defaults.extraction() : defaults.analysis();
        CapabilityModel resolved = fromId(fallback);
        if (resolved == AUTO) {
            throw new IllegalStateException("Default " + role + " model must not be auto");
        }
        return resolved.id;
    }

    public record ModelDefaults(String extraction, String analysis) {
    }
}
