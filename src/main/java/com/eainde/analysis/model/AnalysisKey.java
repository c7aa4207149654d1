package com.eainde.analysis.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of an analysis: subject plus the resolved model ids of both capability calls.
 * Two requests with equal keys share a run and a cache entry.
 */
public record AnalysisKey(String subject, String extractionModel, String analysisModel) implements Serializable {

    private static final Pattern SUBJECT = Pattern.compile("[A-Z0-9][A-Z0-9._-]{0,31}");

    public AnalysisKey {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(extractionModel, "extractionModel");
        Objects.requireNonNull(analysisModel, "analysisModel");
        subject = normalizeSubject(subject);
    }

    public static String normalizeSubject(String subject) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        String normalized = subject.trim().toUpperCase(Locale.ROOT);
        if (!SUBJECT.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid subject: " + subject);
        }
        return normalized;
    }

    /**
     * {@code subject|extractionModel|analysisModel}, the form hashed into cache file names.
     */
    public String canonical() {
        return subject + "|" + extractionModel + "|" + analysisModel;
    }

    /**
     * File-system safe combination of both model ids, used for snapshot directories.
     */
    public String modelKey() {
        return sanitize(extractionModel) + "__" + sanitize(analysisModel);
    }

    private static String sanitize(String modelId) {
        return modelId.replaceAll("[^A-Za-z0-9.-]", "_");
    }
}
