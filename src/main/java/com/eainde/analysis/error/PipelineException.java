package com.eainde.analysis.error;

import com.eainde.analysis.model.UsageCounters;

/**
 * Base type of every fatal failure raised inside a pipeline stage.
 * <p>
 * The stage runner turns it into a {@code StageError} of the matching {@link ErrorKind}.
 * Anything else thrown by a stage is recorded as {@link ErrorKind#INTERNAL}.
 */
public abstract class PipelineException extends RuntimeException {

    private UsageCounters usage = UsageCounters.ZERO;

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    /**
     * Tokens and cost already spent when the stage failed, e.g. on a response that did not validate.
     */
    public UsageCounters usage() {
        return usage;
    }

    public PipelineException withUsage(UsageCounters usage) {
        this.usage = usage == null ? UsageCounters.ZERO : usage;
        return this;
    }

    /**
     * Partial output worth keeping in the ledger next to the error, or {@code null}.
     */
    public Object detail() {
        return null;
    }
}
