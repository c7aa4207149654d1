package com.eainde.analysis.state;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.model.AnalysisReport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only record of one run.
 * <p>
 * Stage results are accepted strictly in {@link StageName} order, each at most once, and only while the
 * ledger is {@link RunStatus#RUNNING}. Status moves {@code PENDING -> RUNNING -> COMPLETE | FAILED} and never
 * back. Every violation is an {@link IllegalStateException}.
 */
public final class PipelineLedger {

    private final String runId;
    private final AnalysisKey key;
    private final Instant createdAt;
    private final List<StageResult> results = new ArrayList<>();
    private RunStatus status = RunStatus.PENDING;
    private AnalysisReport finalReport;
    private Instant completedAt;

    public PipelineLedger(String runId, AnalysisKey key, Instant createdAt) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.key = Objects.requireNonNull(key, "key");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Rebuilds a terminal ledger from its persisted form.
     */
    public static PipelineLedger restore(LedgerSnapshot snapshot) {
        if (!snapshot.status().isTerminal()) {
            throw new IllegalArgumentException("Only terminal ledgers can be restored, got " + snapshot.status());
        }
        PipelineLedger ledger = new PipelineLedger(snapshot.runId(), snapshot.key(), snapshot.createdAt());
        ledger.results.addAll(snapshot.stages());
        ledger.status = snapshot.status();
        ledger.finalReport = snapshot.finalReport();
        ledger.completedAt = snapshot.completedAt();
        return ledger;
    }

    public String runId() {
        return runId;
    }

    public AnalysisKey key() {
        return key;
    }

    public synchronized RunStatus status() {
        return status;
    }

    public synchronized void markRunning() {
        if (status != RunStatus.PENDING) {
            throw new IllegalStateException("Run " + runId + " cannot start from " + status);
        }
        status = RunStatus.RUNNING;
    }

    public synchronized void append(StageResult result) {
        Objects.requireNonNull(result, "result");
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is " + status + ", cannot append " + result.stage());
        }
        StageName expected = nextStage().orElseThrow(() ->
                new IllegalStateException("Run " + runId + " already holds every stage"));
        if (result.stage() != expected) {
            throw new IllegalStateException("Run " + runId + " expects " + expected + " but got " + result.stage());
        }
        if (!results.isEmpty()) {
            StageResult previous = results.get(results.size() - 1);
            if (previous.failed()) {
                throw new IllegalStateException("Run " + runId + " already failed at " + previous.stage());
            }
            if (result.startedAt().isBefore(previous.finishedAt())) {
                throw new IllegalStateException("Run " + runId + ": " + result.stage()
                        + " started before " + previous.stage() + " finished");
            }
        }
        results.add(result);
    }

    public synchronized void complete(AnalysisReport report, Instant at) {
        Objects.requireNonNull(report, "report");
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " cannot complete from " + status);
        }
        if (results.size() != StageName.total() || results.stream().anyMatch(StageResult::failed)) {
            throw new IllegalStateException("Run " + runId + " cannot complete without every stage succeeding");
        }
        this.finalReport = report;
        this.completedAt = at;
        this.status = RunStatus.COMPLETE;
    }

    public synchronized void fail(Instant at) {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " cannot fail from " + status);
        }
        this.completedAt = at;
        this.status = RunStatus.FAILED;
    }

    public synchronized Optional<StageName> nextStage() {
        if (results.isEmpty()) {
            return Optional.of(StageName.EXTRACT);
        }
        return results.get(results.size() - 1).stage().next();
    }

    public synchronized Optional<StageResult> lastResult() {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(results.size() - 1));
    }

    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(runId, key, status, results, finalReport, createdAt, completedAt);
    }
}
