package com.eainde.analysis.source;

import java.io.Serializable;

/**
 * Already-extracted statement text of a subject, with the market data the calculate stage needs.
 * {@code stockPrice} and {@code currency} are optional.
 */
public record SourceDocument(String subject, String text, Double stockPrice, String currency) implements Serializable {
}
