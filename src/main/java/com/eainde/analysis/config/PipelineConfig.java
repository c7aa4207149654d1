package com.eainde.analysis.config;

import com.eainde.analysis.cache.FileLedgerStore;
import com.eainde.analysis.cache.LedgerStore;
import com.eainde.analysis.cache.ResultCache;
import com.eainde.analysis.cache.StageSnapshotWriter;
import com.eainde.analysis.capability.CapabilityModel.ModelDefaults;
import com.eainde.analysis.capability.JsonResponseParser;
import com.eainde.analysis.capability.StructuredCapability;
import com.eainde.analysis.edges.StageRoutingEdge;
import com.eainde.analysis.nodes.AnalyzeNode;
import com.eainde.analysis.nodes.CalculateNode;
import com.eainde.analysis.nodes.ExtractNode;
import com.eainde.analysis.nodes.FormatNode;
import com.eainde.analysis.nodes.ValidateNode;
import com.eainde.analysis.schema.ResponseSchemas;
import com.eainde.analysis.schema.SchemaValidator;
import com.eainde.analysis.source.FileSystemSourceDocumentProvider;
import com.eainde.analysis.source.SourceDocumentProvider;
import com.eainde.analysis.stage.AnalysisAdapter;
import com.eainde.analysis.stage.BreakdownGuard;
import com.eainde.analysis.stage.ConsistencyChecker;
import com.eainde.analysis.stage.ExtractionAdapter;
import com.eainde.analysis.stage.MetricsCalculator;
import com.eainde.analysis.stage.PromptCatalog;
import com.eainde.analysis.stage.ReportFormatter;
import com.eainde.analysis.state.AnalysisState;
import com.eainde.analysis.thread.MdcAwareThreadPoolExecutor;
import com.eainde.analysis.workflow.ActiveRunRegistry;
import com.eainde.analysis.workflow.PipelineOrchestrator;
import com.eainde.analysis.workflow.StageRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.CompiledGraph;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;

@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // one thread per active run
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runExecutor(AnalysisProperties properties) {
        int threads = properties.getPipeline().getRunThreads();
        return new MdcAwareThreadPoolExecutor("analysis-run", threads, threads, 0L, new LinkedBlockingQueue<>());
    }

    // stage bodies, so the run thread can time them out; a timed-out body may linger on its thread
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor() {
        return new MdcAwareThreadPoolExecutor("analysis-stage", 0, Integer.MAX_VALUE, 60L, new SynchronousQueue<>());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamExecutor() {
        return new MdcAwareThreadPoolExecutor("analysis-stream", 0, Integer.MAX_VALUE, 60L, new SynchronousQueue<>());
    }

    @Bean
    public LedgerStore ledgerStore(AnalysisProperties properties, ObjectMapper objectMapper) {
        return new FileLedgerStore(Path.of(properties.getCache().getDirectory()), objectMapper);
    }

    @Bean
    public ResultCache resultCache(LedgerStore ledgerStore, AnalysisProperties properties, Clock clock) {
        return new ResultCache(ledgerStore, properties.getCache().getTtl(), clock);
    }

    @Bean
    public StageSnapshotWriter stageSnapshotWriter(AnalysisProperties properties, ObjectMapper objectMapper) {
        AnalysisProperties.Snapshots snapshots = properties.getSnapshots();
        return new StageSnapshotWriter(Path.of(snapshots.getDirectory()), snapshots.isEnabled(), objectMapper);
    }

    @Bean
    public SourceDocumentProvider sourceDocumentProvider(AnalysisProperties properties, ObjectMapper objectMapper) {
        return new FileSystemSourceDocumentProvider(Path.of(properties.getSource().getDirectory()), objectMapper);
    }

    @Bean
    public ActiveRunRegistry activeRunRegistry() {
        return new ActiveRunRegistry();
    }

    @Bean
    public StageRunner stageRunner(ActiveRunRegistry activeRunRegistry,
                                   @Qualifier("stageExecutor") ExecutorService stageExecutor,
                                   AnalysisProperties properties,
                                   StageSnapshotWriter stageSnapshotWriter,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        return new StageRunner(activeRunRegistry, stageExecutor, properties.getPipeline().getStageTimeout(),
                stageSnapshotWriter, objectMapper, clock);
    }

    @Bean
    public ExtractNode extractNode(StageRunner stageRunner, StructuredCapability capability, PromptCatalog prompts,
                                   ResponseSchemas schemas, SchemaValidator validator, JsonResponseParser parser,
                                   ObjectMapper objectMapper) {
        return new ExtractNode(stageRunner,
                new ExtractionAdapter(capability, prompts, schemas.extraction(), validator, parser, objectMapper));
    }

    @Bean
    public CalculateNode calculateNode(StageRunner stageRunner) {
        return new CalculateNode(stageRunner, new MetricsCalculator());
    }

    @Bean
    public ValidateNode validateNode(StageRunner stageRunner, AnalysisProperties properties) {
        return new ValidateNode(stageRunner, new ConsistencyChecker(properties.getConsistency().toPolicy()));
    }

    @Bean
    public AnalyzeNode analyzeNode(StageRunner stageRunner, StructuredCapability capability, PromptCatalog prompts,
                                   ResponseSchemas schemas, SchemaValidator validator, JsonResponseParser parser,
                                   ObjectMapper objectMapper) {
        return new AnalyzeNode(stageRunner, new AnalysisAdapter(capability, prompts, schemas.analysis(), validator,
                parser, new BreakdownGuard(), objectMapper));
    }

    @Bean
    public FormatNode formatNode(StageRunner stageRunner) {
        return new FormatNode(stageRunner, new ReportFormatter());
    }

    @Bean
    public StageRoutingEdge stageRoutingEdge() {
        return new StageRoutingEdge();
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(@Qualifier("analysisWorkflow") CompiledGraph<AnalysisState> analysisWorkflow,
                                                     ActiveRunRegistry activeRunRegistry,
                                                     ResultCache resultCache,
                                                     SourceDocumentProvider sourceDocumentProvider,
                                                     StageSnapshotWriter stageSnapshotWriter,
                                                     @Qualifier("runExecutor") ExecutorService runExecutor,
                                                     ModelDefaults modelDefaults,
                                                     AnalysisProperties properties,
                                                     Clock clock) {
        return new PipelineOrchestrator(analysisWorkflow, activeRunRegistry, resultCache, sourceDocumentProvider,
                stageSnapshotWriter, runExecutor, modelDefaults,
                properties.getPipeline().getAutoRetry().getMaxAttempts(), clock);
    }
}
