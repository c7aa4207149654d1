package com.eainde.analysis.workflow;

import com.eainde.analysis.cache.StageSnapshotWriter;
import com.eainde.analysis.error.ErrorKind;
import com.eainde.analysis.error.PipelineException;
import com.eainde.analysis.error.StageTimeoutException;
import com.eainde.analysis.model.UsageCounters;
import com.eainde.analysis.model.UsageSummary;
import com.eainde.analysis.stage.StageOutput;
import com.eainde.analysis.state.StageError;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.state.StageResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one stage body for a run: bounds it by the stage timeout, turns its outcome into a
 * {@link StageResult}, appends that to the run's ledger and publishes it.
 * <p>
 * Never throws for a failing body; the failure ends up in the ledger and the caller gets an empty result.
 */
@Log4j2
public class StageRunner {

    private final ActiveRunRegistry runs;
    private final ExecutorService stageExecutor;
    private final Duration timeout;
    private final StageSnapshotWriter snapshots;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StageRunner(ActiveRunRegistry runs, ExecutorService stageExecutor, Duration timeout,
                       StageSnapshotWriter snapshots, ObjectMapper objectMapper, Clock clock) {
        this.runs = runs;
        this.stageExecutor = stageExecutor;
        this.timeout = timeout;
        this.snapshots = snapshots;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public <T> Optional<T> run(String runId, StageName stage, Callable<StageOutput<T>> body) {
        RunHandle run = runs.byId(runId);
        Instant startedAt = clock.instant();
        StageResult result;
        T payload = null;
        try {
            StageOutput<T> output = await(stage, body);
            payload = output.payload();
            result = StageResult.success(stage, toTree(payload), startedAt, clock.instant(), output.usage());
            log.info("Stage {}/{} {} finished in {} ms", stage.ordinalNumber(), StageName.total(), stage,
                    Duration.between(startedAt, result.finishedAt()).toMillis());
        } catch (PipelineException e) {
            log.warn("Stage {} failed with {}: {}", stage, e.kind(), e.getMessage());
            result = StageResult.failure(stage, detail(e), new StageError(e.kind(), e.getMessage()),
                    startedAt, clock.instant(), e.usage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Stage {} interrupted", stage);
            result = StageResult.failure(stage, null, new StageError(ErrorKind.INTERNAL, "Stage interrupted"),
                    startedAt, clock.instant(), UsageCounters.ZERO);
        } catch (Exception e) {
            log.error("Stage {} failed unexpectedly", stage, e);
            result = StageResult.failure(stage, null, new StageError(ErrorKind.INTERNAL, describe(e)),
                    startedAt, clock.instant(), UsageCounters.ZERO);
        }

        run.record(result);
        snapshots.write(run.snapshot(), stage.snapshotLabel());
        return result.failed() ? Optional.empty() : Optional.ofNullable(payload);
    }

    /**
     * Usage of every stage recorded so far for the run.
     */
    public UsageSummary usageSoFar(String runId) {
        return runs.byId(runId).snapshot().usage();
    }

    private <T> StageOutput<T> await(StageName stage, Callable<StageOutput<T>> body) throws Exception {
        Future<StageOutput<T>> future = stageExecutor.submit(body);
        try {
            StageOutput<T> output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                throw new IllegalStateException("Stage " + stage + " produced no output");
            }
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StageTimeoutException(stage.name(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private JsonNode toTree(Object payload) {
        return payload == null ? null : objectMapper.valueToTree(payload);
    }

    private JsonNode detail(PipelineException e) {
        try {
            return toTree(e.detail());
        } catch (IllegalArgumentException serializationFailure) {
            log.warn("Could not keep failure detail of {}: {}", e.kind(), serializationFailure.getMessage());
            return null;
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
