package com.eainde.analysis.workflow;

import com.eainde.analysis.cache.CacheEntry;
import com.eainde.analysis.cache.ResultCache;
import com.eainde.analysis.cache.StageSnapshotWriter;
import com.eainde.analysis.capability.CapabilityModel;
import com.eainde.analysis.capability.CapabilityModel.ModelDefaults;
import com.eainde.analysis.capability.CapabilityRole;
import com.eainde.analysis.error.ErrorKind;
import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.progress.ProgressEvent;
import com.eainde.analysis.progress.ProgressSubscription;
import com.eainde.analysis.source.SourceDocument;
import com.eainde.analysis.source.SourceDocumentProvider;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.state.LedgerSnapshot;
import com.eainde.analysis.state.PipelineLedger;
import com.eainde.analysis.state.StageError;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.state.StageResult;
import com.eainde.analysis.model.UsageCounters;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of analysis runs.
 * <p>
 * For any key at most one run is in flight: a request for a key with an active run attaches to it, a request
 * for a key with a cached result is served from the cache, and only otherwise a new run is started. The
 * check-and-start happens under the key's lock. A completed run is cached before it leaves the registry,
 * so a key is always either active, cached, or absent.
 *
 * <h3>Failures</h3>
 * A failed run is never cached. With {@code maxAutoRetries > 0}, a run failing with a transient
 * {@link ErrorKind} is followed by a fresh run for the same key, up to that many times.
 */
@Log4j2
public class PipelineOrchestrator {

    public static final String MDC_SUBJECT = "subject";
    public static final String MDC_RUN_ID = "runId";

    private final CompiledGraph<AnalysisState> workflow;
    private final ActiveRunRegistry runs;
    private final ResultCache cache;
    private final SourceDocumentProvider sources;
    private final StageSnapshotWriter snapshots;
    private final Executor runExecutor;
    private final ModelDefaults modelDefaults;
    private final int maxAutoRetries;
    private final Clock clock;

    public PipelineOrchestrator(CompiledGraph<AnalysisState> workflow,
                                ActiveRunRegistry runs,
                                ResultCache cache,
                                SourceDocumentProvider sources,
                                StageSnapshotWriter snapshots,
                                Executor runExecutor,
                                ModelDefaults modelDefaults,
                                int maxAutoRetries,
                                Clock clock) {
        this.workflow = workflow;
        this.runs = runs;
        this.cache = cache;
        this.sources = sources;
        this.snapshots = snapshots;
        this.runExecutor = runExecutor;
        this.modelDefaults = modelDefaults;
        this.maxAutoRetries = maxAutoRetries;
        this.clock = clock;
    }

    /**
     * Resolves the caller's model choices and starts, attaches to, or serves the analysis of a subject.
     *
     * @throws IllegalArgumentException for a blank subject or an unsupported model id
     * @throws com.eainde.analysis.error.UnknownSubjectException    for a subject without statements
     * @throws com.eainde.analysis.error.NoSourceDocumentException for a subject whose statement text is empty
     */
    public TriggerResult trigger(String subject, String extractionChoice, String analysisChoice) {
        return begin(resolveKey(subject, extractionChoice, analysisChoice));
    }

    public AnalysisKey resolveKey(String subject, String extractionChoice, String analysisChoice) {
        return new AnalysisKey(
                AnalysisKey.normalizeSubject(subject),
                CapabilityModel.resolve(extractionChoice, CapabilityRole.EXTRACTION, modelDefaults),
                CapabilityModel.resolve(analysisChoice, CapabilityRole.ANALYSIS, modelDefaults));
    }

    public RunHandle start(AnalysisKey key) {
        return begin(key).handle();
    }

    public ProgressSubscription subscribe(RunHandle run) {
        return run.subscribe();
    }

    public LedgerSnapshot getState(RunHandle run) {
        return run.snapshot();
    }

    /**
     * The active run or the cached result of a key; never starts anything.
     */
    public Optional<RunHandle> find(AnalysisKey key) {
        return runs.withKeyLock(key, () -> runs.active(key)
                .or(() -> cache.check(key).map(entry -> RunHandle.cached(entry.ledger()))));
    }

    private TriggerResult begin(AnalysisKey key) {
        return runs.withKeyLock(key, () -> {
            Optional<RunHandle> active = runs.active(key);
            if (active.isPresent()) {
                log.info("Attaching to run {} for {}", active.get().runId(), key.canonical());
                return new TriggerResult(active.get(), TriggerResult.Origin.ATTACHED);
            }
            Optional<CacheEntry> cached = cache.check(key);
            if (cached.isPresent()) {
                log.info("Serving {} from cache (run {})", key.canonical(), cached.get().ledger().runId());
                return new TriggerResult(RunHandle.cached(cached.get().ledger()), TriggerResult.Origin.CACHED);
            }
            SourceDocument source = sources.load(key.subject());
            return new TriggerResult(launch(key, source, 0), TriggerResult.Origin.STARTED);
        });
    }

    // caller holds the key lock
    private RunHandle launch(AnalysisKey key, SourceDocument source, int attempt) {
        PipelineLedger ledger = new PipelineLedger(UUID.randomUUID().toString(), key, clock.instant());
        RunHandle run = RunHandle.live(ledger);
        runs.register(run);
        snapshots.write(ledger.snapshot(), StageSnapshotWriter.INITIAL);
        log.info("Starting run {} for {} (attempt {})", run.runId(), key.canonical(), attempt + 1);
        try {
            runExecutor.execute(() -> execute(run, source, attempt));
        } catch (RejectedExecutionException e) {
            runs.retire(run);
            throw e;
        }
        return run;
    }

    private void execute(RunHandle run, SourceDocument source, int attempt) {
        // PENDING until a run thread picks it up
        run.ledger().markRunning();
        MDC.put(MDC_SUBJECT, run.key().subject());
        MDC.put(MDC_RUN_ID, run.runId());
        AnalysisReport report = null;
        try {
            Optional<AnalysisState> result = workflow.invoke(AnalysisState.inputs(run.runId(), run.key(), source));
            report = result.flatMap(AnalysisState::getReport).orElse(null);
        } catch (Exception e) {
            log.error("Run {} aborted outside of a stage", run.runId(), e);
        } finally {
            try {
                finish(run, source, attempt, report);
            } finally {
                MDC.remove(MDC_SUBJECT);
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    private void finish(RunHandle run, SourceDocument source, int attempt, AnalysisReport report) {
        PipelineLedger ledger = run.ledger();
        boolean succeeded = report != null && ledger.lastResult()
                .filter(last -> last.stage() == StageName.FORMAT && !last.failed())
                .isPresent();

        if (succeeded) {
            ledger.complete(report, clock.instant());
            LedgerSnapshot terminal = ledger.snapshot();
            try {
                cache.put(run.key(), terminal);
            } catch (RuntimeException e) {
                log.error("Run {} completed but could not be cached", run.runId(), e);
            }
            snapshots.write(terminal, StageSnapshotWriter.FINAL);
            runs.withKeyLock(run.key(), () -> {
                runs.retire(run);
                return null;
            });
            log.info("Run {} COMPLETE for {}", run.runId(), run.key().canonical());
            run.progress().close(ProgressEvent.completed(report, terminal.completedAt()));
            run.finish(terminal);
            return;
        }

        StageResult failure = ensureFailureRecorded(run);
        ledger.fail(clock.instant());
        LedgerSnapshot terminal = ledger.snapshot();
        snapshots.write(terminal, StageSnapshotWriter.FINAL);
        StageError error = failure.error();
        runs.withKeyLock(run.key(), () -> {
            runs.retire(run);
            if (error.kind().isTransient() && attempt < maxAutoRetries && cache.check(run.key()).isEmpty()) {
                log.info("Retrying {} after {} ({} of {})", run.key().canonical(), error.kind(), attempt + 1, maxAutoRetries);
                run.retriedBy(launch(run.key(), source, attempt + 1));
            }
            return null;
        });
        log.warn("Run {} FAILED at {} with {}: {}", run.runId(), failure.stage(), error.kind(), error.message());
        run.progress().close(ProgressEvent.failed(failure.stage(), error, terminal.completedAt()));
        run.finish(terminal);
    }

    /**
     * The failing stage result of the run, appending an {@link ErrorKind#INTERNAL} one when the graph stopped
     * without recording a failure.
     */
    private StageResult ensureFailureRecorded(RunHandle run) {
        PipelineLedger ledger = run.ledger();
        Optional<StageResult> last = ledger.lastResult();
        if (last.isPresent() && last.get().failed()) {
            return last.get();
        }
        StageName stage = ledger.nextStage().orElse(StageName.FORMAT);
        Instant now = clock.instant();
        Instant startedAt = last.map(StageResult::finishedAt).filter(now::isBefore).orElse(now);
        StageResult failure = StageResult.failure(stage, null,
                new StageError(ErrorKind.INTERNAL, "Run stopped before " + stage + " recorded a result"),
                startedAt, startedAt, UsageCounters.ZERO);
        if (ledger.nextStage().isPresent()) {
            run.record(failure);
        }
        return failure;
    }
}
