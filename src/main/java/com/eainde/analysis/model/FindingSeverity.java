package com.eainde.analysis.model;

public enum FindingSeverity {
    WARNING,
    CONTRADICTION
}
