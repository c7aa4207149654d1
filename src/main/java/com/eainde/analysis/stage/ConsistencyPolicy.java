package com.eainde.analysis.stage;

/**
 * Tolerance bands of the consistency checker.
 *
 * @param warningTolerance       relative deviation above which a check warns
 * @param contradictionTolerance relative deviation above which a check contradicts, never below the warning band
 * @param absoluteFallback       warning limit used instead of a relative band when the base value is zero
 */
public record ConsistencyPolicy(double warningTolerance, double contradictionTolerance, double absoluteFallback) {

    public static final ConsistencyPolicy DEFAULT = new ConsistencyPolicy(0.01, 0.10, 1000);

    public ConsistencyPolicy {
        if (warningTolerance < 0 || absoluteFallback < 0) {
            throw new IllegalArgumentException("Tolerances must not be negative");
        }
        if (contradictionTolerance < warningTolerance) {
            throw new IllegalArgumentException("Contradiction tolerance " + contradictionTolerance
                    + " is narrower than warning tolerance " + warningTolerance);
        }
    }
}
