package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomeItem(String name, Double amount) implements Serializable {
}
