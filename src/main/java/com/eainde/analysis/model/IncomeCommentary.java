package com.eainde.analysis.model;

import java.io.Serializable;

public record IncomeCommentary(String item, String commentary) implements Serializable {
}
