package com.eainde.analysis.workflow;

/**
 * How a trigger was served.
 */
public record TriggerResult(RunHandle handle, Origin origin) {

    public enum Origin {
        /** a new run was started */
        STARTED,
        /** joined a run already in flight for the key */
        ATTACHED,
        /** served from the result cache, nothing ran */
        CACHED
    }
}
