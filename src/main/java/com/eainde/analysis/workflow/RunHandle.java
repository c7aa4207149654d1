package com.eainde.analysis.workflow;

import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.progress.ProgressBroadcaster;
import com.eainde.analysis.progress.ProgressEvent;
import com.eainde.analysis.progress.ProgressSubscription;
import com.eainde.analysis.state.LedgerSnapshot;
import com.eainde.analysis.state.PipelineLedger;
import com.eainde.analysis.state.StageResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's reference to a run: its ledger, its progress channel and its eventual outcome.
 * A handle over a cached result is born terminal.
 */
public class RunHandle {

    private final PipelineLedger ledger;
    private final ProgressBroadcaster progress;
    private final boolean cached;
    private final CompletableFuture<LedgerSnapshot> completion = new CompletableFuture<>();
    private volatile RunHandle retry;

    RunHandle(PipelineLedger ledger, ProgressBroadcaster progress, boolean cached) {
        this.ledger = ledger;
        this.progress = progress;
        this.cached = cached;
    }

    static RunHandle live(PipelineLedger ledger) {
        return new RunHandle(ledger, new ProgressBroadcaster(ledger.runId()), false);
    }

    static RunHandle cached(LedgerSnapshot snapshot) {
        RunHandle handle = new RunHandle(PipelineLedger.restore(snapshot), ProgressBroadcaster.replayOf(snapshot), true);
        handle.completion.complete(snapshot);
        return handle;
    }

    public String runId() {
        return ledger.runId();
    }

    public AnalysisKey key() {
        return ledger.key();
    }

    public boolean isCached() {
        return cached;
    }

    public LedgerSnapshot snapshot() {
        return ledger.snapshot();
    }

    public ProgressSubscription subscribe() {
        return progress.subscribe();
    }

    /**
     * Completes with the terminal ledger; never exceptionally.
     */
    public CompletableFuture<LedgerSnapshot> completion() {
        return completion.copy();
    }

    /**
     * The fresh run started automatically after this one failed, if any. Set before {@link #completion()}
     * completes.
     */
    public Optional<RunHandle> retry() {
        return Optional.ofNullable(retry);
    }

    PipelineLedger ledger() {
        return ledger;
    }

    ProgressBroadcaster progress() {
        return progress;
    }

    void record(StageResult result) {
        ledger.append(result);
        progress.publish(ProgressEvent.stage(result));
    }

    void retriedBy(RunHandle successor) {
        this.retry = successor;
    }

    void finish(LedgerSnapshot terminal) {
        completion.complete(terminal);
    }
}
