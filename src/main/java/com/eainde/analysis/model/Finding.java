package com.eainde.analysis.model;

import java.io.Serializable;

/**
 * One observation of the consistency checker or the breakdown guard.
 */
public record Finding(String check, FindingSeverity severity, String message) implements Serializable {

    public static Finding warning(String check, String message) {
        return new Finding(check, FindingSeverity.WARNING, message);
    }

    public static Finding contradiction(String check, String message) {
        return new Finding(check, FindingSeverity.CONTRADICTION, message);
    }

    public boolean isContradiction() {
        return severity == FindingSeverity.CONTRADICTION;
    }
}
