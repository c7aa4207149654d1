package com.eainde.analysis.error;

import com.eainde.analysis.schema.SchemaViolation;

import java.util.List;
import java.util.stream.Collectors;

public class SchemaValidationException extends PipelineException {

    private final List<SchemaViolation> violations;

    public SchemaValidationException(String message) {
        super(message);
        this.violations = List.of();
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public SchemaValidationException(String schemaName, List<SchemaViolation> violations) {
        super("Response does not match schema '" + schemaName + "': " + violations.stream()
                .map(SchemaViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> violations() {
        return violations;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCHEMA_VALIDATION;
    }
}
