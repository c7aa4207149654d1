package com.eainde.analysis.stage;

import com.eainde.analysis.AnalysisFixtures;
import com.eainde.analysis.capability.CapabilityRequest;
import com.eainde.analysis.capability.CapabilityResponse;
import com.eainde.analysis.capability.JsonResponseParser;
import com.eainde.analysis.capability.StructuredCapability;
import com.eainde.analysis.error.SchemaValidationException;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.UsageCounters;
import com.eainde.analysis.model.ValidationReport;
import com.eainde.analysis.schema.ResponseSchemas;
import com.eainde.analysis.schema.SchemaValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisAdapterTest {

    @Mock
    private StructuredCapability capability;

    private AnalysisAdapter adapter;
    private final FinancialFacts facts = AnalysisFixtures.facts();
    private final DerivedMetrics metrics = new MetricsCalculator().calculate(facts, 50.0);

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = AnalysisFixtures.objectMapper();
        adapter = new AnalysisAdapter(capability, new PromptCatalog(objectMapper),
                new ResponseSchemas(objectMapper).analysis(), new SchemaValidator(),
                new JsonResponseParser(objectMapper), new BreakdownGuard(), objectMapper);
    }

    @Test
    @DisplayName("analyze() should bind the narrative and keep supported commentary")
    void analyze_shouldBindNarrative() {
        // Arrange
        when(capability.invoke(any())).thenReturn(
                new CapabilityResponse(AnalysisFixtures.analysisResponse(), new UsageCounters(10, 5, 15, 0.1)));

        // Act
        StageOutput<GuardedAnalysis> output = adapter.analyze(facts, metrics, new ValidationReport(List.of()),
                AnalysisFixtures.ANALYSIS_MODEL);

        // Assert
        assertThat(output.payload().analysis().companyType()).isEqualTo("operating");
        assertThat(output.payload().analysis().segmentCommentary()).hasSize(1);
        assertThat(output.payload().warnings()).isEmpty();
        assertThat(output.usage().totalTokens()).isEqualTo(15);
    }

    @Test
    @DisplayName("analyze() should pass consistency warnings into the prompt")
    void analyze_shouldIncludeWarningsInPrompt() {
        // Arrange
        when(capability.invoke(any())).thenReturn(
                new CapabilityResponse(AnalysisFixtures.analysisResponse(), UsageCounters.ZERO));
        ValidationReport validation = new ValidationReport(List.of(
                Finding.warning("net-income-consistency", "Cash flow statement net income differs")));
        ArgumentCaptor<CapabilityRequest> request = ArgumentCaptor.forClass(CapabilityRequest.class);

        // Act
        adapter.analyze(facts, metrics, validation, AnalysisFixtures.ANALYSIS_MODEL);

        // Assert
        verify(capability).invoke(request.capture());
        assertThat(request.getValue().modelId()).isEqualTo(AnalysisFixtures.ANALYSIS_MODEL);
        assertThat(request.getValue().userPrompt())
                .contains("Cash flow statement net income differs")
                .contains("\"company_name\" : \"Acme Industries Limited\"");
    }

    @Test
    @DisplayName("analyze() should strip commentary on segments absent from the facts")
    void analyze_shouldGuardBreakdowns_whenSegmentsEmpty() {
        // Arrange
        FinancialFacts noSegments = facts.toBuilder().segments(List.of()).build();
        when(capability.invoke(any())).thenReturn(
                new CapabilityResponse(AnalysisFixtures.analysisResponse(), UsageCounters.ZERO));

        // Act
        StageOutput<GuardedAnalysis> output = adapter.analyze(noSegments,
                new MetricsCalculator().calculate(noSegments, 50.0), new ValidationReport(List.of()),
                AnalysisFixtures.ANALYSIS_MODEL);

        // Assert
        assertThat(output.payload().analysis().segmentCommentary()).isEmpty();
        assertThat(output.payload().warnings()).extracting(Finding::check).containsExactly(BreakdownGuard.CHECK);
    }

    @Test
    @DisplayName("analyze() should reject a company type outside the allowed values")
    void analyze_shouldRejectInvalidEnum() {
        // Arrange
        String response = AnalysisFixtures.analysisResponse().replace("\"operating\"", "\"conglomerate\"");
        UsageCounters usage = new UsageCounters(2000, 700, 2700, 0.012);
        when(capability.invoke(any())).thenReturn(new CapabilityResponse(response, usage));

        // Act & Assert
        assertThatThrownBy(() -> adapter.analyze(facts, metrics, new ValidationReport(List.of()),
                AnalysisFixtures.ANALYSIS_MODEL))
                .isInstanceOfSatisfying(SchemaValidationException.class, e -> assertThat(e.usage()).isEqualTo(usage))
                .hasMessageContaining("$.company_type");
    }
}
