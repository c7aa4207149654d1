package com.eainde.analysis.error;

import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.ValidationReport;

import java.util.stream.Collectors;

/**
 * Raised by the validate stage when at least one finding is a contradiction. Carries the full report
 * so the failed stage result still shows every finding.
 */
public class ConsistencyContradictionException extends PipelineException {

    private final ValidationReport report;

    public ConsistencyContradictionException(ValidationReport report) {
        super("Consistency contradiction: " + report.contradictions().stream()
                .map(Finding::message)
                .collect(Collectors.joining("; ")));
        this.report = report;
    }

    public ValidationReport report() {
        return report;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONSISTENCY_CONTRADICTION;
    }

    @Override
    public Object detail() {
        return report;
    }
}
