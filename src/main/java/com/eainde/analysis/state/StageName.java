package com.eainde.analysis.state;

import java.util.Locale;
import java.util.Optional;

/**
 * The five pipeline stages in canonical order.
 */
public enum StageName {
    EXTRACT,
    CALCULATE,
    VALIDATE,
    ANALYZE,
    FORMAT;

    /**
     * 1-based position in the pipeline.
     */
    public int ordinalNumber() {
        return ordinal() + 1;
    }

    public static int total() {
        return values().length;
    }

    public Optional<StageName> next() {
        StageName[] stages = values();
        return ordinal() + 1 < stages.length ? Optional.of(stages[ordinal() + 1]) : Optional.empty();
    }

    /**
     * Graph node id of this stage.
     */
    public String nodeId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Prefix of snapshot files, e.g. {@code 01_extract}.
     */
    public String snapshotLabel() {
        return String.format("%02d_%s", ordinalNumber(), nodeId());
    }
}
