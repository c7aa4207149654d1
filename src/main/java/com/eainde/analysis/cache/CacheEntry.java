package com.eainde.analysis.cache;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.state.LedgerSnapshot;

import java.time.Instant;

/**
 * Persisted COMPLETE ledger of a key.
 */
public record CacheEntry(AnalysisKey key, LedgerSnapshot ledger, Instant storedAt) {
}
