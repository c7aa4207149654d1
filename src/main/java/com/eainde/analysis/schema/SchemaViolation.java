package com.eainde.analysis.schema;

/**
 * @param path JSON-pointer-like location, {@code $} for the root
 */
public record SchemaViolation(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
