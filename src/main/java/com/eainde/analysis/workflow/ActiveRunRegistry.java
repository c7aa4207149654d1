package com.eainde.analysis.workflow;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.thread.KeyedLocks;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs in flight, by key and by run id. Entries live from start until the terminal status is recorded.
 * Mutations happen under the key's lock.
 */
public class ActiveRunRegistry {

    private final Map<AnalysisKey, RunHandle> byKey = new ConcurrentHashMap<>();
    private final Map<String, RunHandle> byId = new ConcurrentHashMap<>();
    private final KeyedLocks<AnalysisKey> locks = new KeyedLocks<>();

    public <T> T withKeyLock(AnalysisKey key, Supplier<T> action) {
        return locks.withLock(key, action);
    }

    public Optional<RunHandle> active(AnalysisKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public RunHandle byId(String runId) {
        RunHandle run = byId.get(runId);
        if (run == null) {
            throw new IllegalStateException("No active run " + runId);
        }
        return run;
    }

    public int size() {
        return byKey.size();
    }

    void register(RunHandle run) {
        RunHandle existing = byKey.putIfAbsent(run.key(), run);
        if (existing != null) {
            throw new IllegalStateException("Run " + existing.runId() + " is already active for " + run.key().canonical());
        }
        byId.put(run.runId(), run);
    }

    void retire(RunHandle run) {
        byKey.remove(run.key(), run);
        byId.remove(run.runId(), run);
    }
}
