package com.eainde.analysis.controller;

import com.eainde.analysis.config.AnalysisProperties;
import com.eainde.analysis.error.AnalysisNotFoundException;
import com.eainde.analysis.model.AnalysisKey;
import com.eainde.analysis.progress.ProgressEvent;
import com.eainde.analysis.progress.ProgressSubscription;
import com.eainde.analysis.state.LedgerSnapshot;
import com.eainde.analysis.state.RunStatus;
import com.eainde.analysis.state.StageName;
import com.eainde.analysis.workflow.PipelineOrchestrator;
import com.eainde.analysis.workflow.RunHandle;
import com.eainde.analysis.workflow.TriggerResult;
import jakarta.validation.Valid;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

@Log4j2
@RestController
@RequestMapping("/v1/analysis")
public class AnalysisController {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final PipelineOrchestrator orchestrator;
    private final ExecutorService streamExecutor;
    private final Duration streamTimeout;

    public AnalysisController(PipelineOrchestrator orchestrator,
                              @Qualifier("streamExecutor") ExecutorService streamExecutor,
                              AnalysisProperties properties) {
        this.orchestrator = orchestrator;
        this.streamExecutor = streamExecutor;
        // every stage may use its full timeout, plus one for the terminal event
        this.streamTimeout = properties.getPipeline().getStageTimeout().multipliedBy(StageName.total() + 1L);
    }

    @PostMapping("/runs")
    public ResponseEntity<?> trigger(@Valid @RequestBody AnalysisRunRequest request) {
        TriggerResult result = orchestrator.trigger(request.subject(), request.extractionModel(),
                request.analysisModel());
        RunHandle handle = result.handle();
        if (result.origin() == TriggerResult.Origin.CACHED) {
            return ResponseEntity.ok(AnalysisSummaryView.of(handle.snapshot()));
        }
        LedgerSnapshot snapshot = handle.snapshot();
        return ResponseEntity.accepted().body(new RunAcceptedView(handle.runId(), handle.key().subject(),
                snapshot.status(), result.origin() == TriggerResult.Origin.ATTACHED));
    }

    @GetMapping("/{subject}")
    public AnalysisSummaryView status(@PathVariable String subject,
                                      @RequestParam(required = false) String extractionModel,
                                      @RequestParam(required = false) String analysisModel) {
        return AnalysisSummaryView.of(locate(subject, extractionModel, analysisModel).snapshot());
    }

    @GetMapping("/{subject}/result")
    public AnalysisResultView result(@PathVariable String subject,
                                     @RequestParam(required = false) String extractionModel,
                                     @RequestParam(required = false) String analysisModel) {
        AnalysisKey key = orchestrator.resolveKey(subject, extractionModel, analysisModel);
        LedgerSnapshot snapshot = orchestrator.find(key)
                .map(RunHandle::snapshot)
                .filter(found -> found.status() == RunStatus.COMPLETE)
                .orElseThrow(() -> new AnalysisNotFoundException(key));
        return AnalysisResultView.of(snapshot);
    }

    @GetMapping("/{subject}/stream")
    public SseEmitter stream(@PathVariable String subject,
                             @RequestParam(required = false) String extractionModel,
                             @RequestParam(required = false) String analysisModel) {
        RunHandle run = locate(subject, extractionModel, analysisModel);
        ProgressSubscription subscription = orchestrator.subscribe(run);
        SseEmitter emitter = new SseEmitter(streamTimeout.toMillis());
        AtomicBoolean open = new AtomicBoolean(true);
        Runnable detach = () -> {
            open.set(false);
            subscription.cancel();
        };
        emitter.onCompletion(detach);
        emitter.onTimeout(detach);
        emitter.onError(error -> detach.run());
        streamExecutor.execute(() -> pump(run, subscription, emitter, open));
        return emitter;
    }

    private RunHandle locate(String subject, String extractionModel, String analysisModel) {
        AnalysisKey key = orchestrator.resolveKey(subject, extractionModel, analysisModel);
        return orchestrator.find(key).orElseThrow(() -> new AnalysisNotFoundException(key));
    }

    private void pump(RunHandle run, ProgressSubscription subscription, SseEmitter emitter, AtomicBoolean open) {
        try {
            while (open.get() && !subscription.isDrained()) {
                Optional<ProgressEvent> next = subscription.next(POLL_INTERVAL);
                if (next.isEmpty()) {
                    continue;
                }
                ProgressEvent event = next.get();
                emitter.send(SseEmitter.event()
                        .name(StreamEventView.name(event))
                        .data(StreamEventView.body(event), MediaType.APPLICATION_JSON));
                if (event.terminal()) {
                    break;
                }
            }
            emitter.complete();
        } catch (IOException e) {
            log.info("Progress stream of run {} closed by client: {}", run.runId(), e.getMessage());
            subscription.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.cancel();
            emitter.completeWithError(e);
        }
    }
}
