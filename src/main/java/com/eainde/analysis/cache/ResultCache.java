package com.eainde.analysis.cache;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.state.LedgerSnapshot;
import com.eainde.analysis.state.RunStatus;
import com.eainde.analysis.thread.KeyedLocks;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Completed ledgers by {@link AnalysisKey}. First writer wins; later writes for the same key are logged
 * and ignored. With a TTL configured, expired entries are evicted when read.
 */
@Log4j2
public class ResultCache {

    private final LedgerStore store;
    private final Duration ttl;
    private final Clock clock;
    private final KeyedLocks<AnalysisKey> locks = new KeyedLocks<>();

    public ResultCache(LedgerStore store, Duration ttl, Clock clock) {
        this.store = store;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<CacheEntry> check(AnalysisKey key) {
        return locks.withLock(key, () -> {
            Optional<CacheEntry> entry = store.read(key);
            if (entry.isPresent() && expired(entry.get())) {
                log.info("Cache entry for {} expired, evicting", key.canonical());
                store.delete(key);
                return Optional.<CacheEntry>empty();
            }
            return entry;
        });
    }

    /**
     * @return {@code true} if stored, {@code false} if an entry for the key already existed
     * @throws IllegalArgumentException for a ledger that is not COMPLETE or belongs to another key
     */
    public boolean put(AnalysisKey key, LedgerSnapshot ledger) {
        if (ledger.status() != RunStatus.COMPLETE) {
            throw new IllegalArgumentException("Only COMPLETE ledgers are cached, got " + ledger.status());
        }
        if (!key.equals(ledger.key())) {
            throw new IllegalArgumentException("Ledger of " + ledger.key().canonical()
                    + " cannot be cached under " + key.canonical());
        }
        return locks.withLock(key, () -> {
            boolean stored = store.createIfAbsent(new CacheEntry(key, ledger, Instant.now(clock)));
            if (stored) {
                log.info("Cached run {} for {}", ledger.runId(), key.canonical());
            } else {
                log.info("Cache write conflict for {}: entry already present, keeping the first one", key.canonical());
            }
            return stored;
        });
    }

    public boolean evict(AnalysisKey key) {
        return locks.withLock(key, () -> {
            boolean removed = store.delete(key);
            if (removed) {
                log.info("Evicted cache entry for {}", key.canonical());
            }
            return removed;
        });
    }

    private boolean expired(CacheEntry entry) {
        return ttl != null && !ttl.isZero() && entry.storedAt().plus(ttl).isBefore(Instant.now(clock));
    }
}
