package com.eainde.analysis.model;

import java.io.Serializable;

public record PeriodValue(Double current, Double previous) implements Serializable {

    public static PeriodValue unknown() {
        return new PeriodValue(null, null);
    }
}
