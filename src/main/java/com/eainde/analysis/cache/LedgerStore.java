package com.eainde.analysis.cache;

import com.eainde.analysis.model.AnalysisKey;

import java.util.Optional;

/**
 * Durable storage behind {@link ResultCache}.
 */
public interface LedgerStore {

    Optional<CacheEntry> read(AnalysisKey key);

    /**
     * Stores the entry unless one already exists for its key.
     *
     * @return {@code false} when an entry was already present
     */
    boolean createIfAbsent(CacheEntry entry);

    boolean delete(AnalysisKey key);
}
