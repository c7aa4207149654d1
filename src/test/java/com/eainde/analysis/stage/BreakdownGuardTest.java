package com.eainde.analysis.stage;

import com.eainde.analysis.AnalysisFixtures;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.IncomeCommentary;
import com.eainde.analysis.model.InvestorAnalysis;
import com.eainde.analysis.model.SegmentCommentary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BreakdownGuardTest {

    private final BreakdownGuard guard = new BreakdownGuard();

    @Test
    @DisplayName("apply() should keep commentary on reported segments regardless of case and spacing")
    void apply_shouldKeepKnownNames() {
        // Arrange
        InvestorAnalysis analysis = InvestorAnalysis.builder()
                .segmentCommentary(List.of(new SegmentCommentary("  cement ", "Strong year")))
                .otherIncomeCommentary(List.of(new IncomeCommentary("DIVIDEND INCOME", "Recurring")))
                .build();

        // Act
        GuardedAnalysis guarded = guard.apply(analysis, AnalysisFixtures.facts());

        // Assert
        assertThat(guarded.analysis().segmentCommentary()).hasSize(1);
        assertThat(guarded.analysis().otherIncomeCommentary()).hasSize(1);
        assertThat(guarded.warnings()).isEmpty();
    }

    @Test
    @DisplayName("apply() should drop commentary on invented breakdowns and warn once per removal")
    void apply_shouldDropUnknownNames() {
        // Arrange
        InvestorAnalysis analysis = InvestorAnalysis.builder()
                .investorSummary("Summary")
                .segmentCommentary(List.of(
                        new SegmentCommentary("Cement", "Strong year"),
                        new SegmentCommentary("Textiles", "Not a segment of this company")))
                .otherIncomeCommentary(List.of(new IncomeCommentary("Rental income", "Invented")))
                .build();

        // Act
        GuardedAnalysis guarded = guard.apply(analysis, AnalysisFixtures.facts());

        // Assert
        assertThat(guarded.analysis().segmentCommentary()).extracting(SegmentCommentary::segment)
                .containsExactly("Cement");
        assertThat(guarded.analysis().otherIncomeCommentary()).isEmpty();
        assertThat(guarded.analysis().investorSummary()).isEqualTo("Summary");
        assertThat(guarded.warnings()).hasSize(2)
                .allSatisfy(finding -> assertThat(finding.check()).isEqualTo(BreakdownGuard.CHECK));
        assertThat(guarded.warnings().get(0).message()).contains("Textiles");
    }

    @Test
    @DisplayName("apply() should drop every breakdown comment when the facts report no breakdowns")
    void apply_shouldDropAllCommentary_whenFactsHaveNoBreakdowns() {
        // Arrange
        InvestorAnalysis analysis = InvestorAnalysis.builder()
                .segmentCommentary(List.of(
                        new SegmentCommentary("Cement", "Strong year"),
                        new SegmentCommentary("Power", "Stable")))
                .otherIncomeCommentary(List.of(new IncomeCommentary("Dividend income", "Recurring")))
                .build();
        FinancialFacts noBreakdowns = AnalysisFixtures.facts().toBuilder()
                .segments(List.of())
                .otherIncome(List.of())
                .build();

        // Act
        GuardedAnalysis guarded = guard.apply(analysis, noBreakdowns);

        // Assert
        assertThat(guarded.analysis().segmentCommentary()).isEmpty();
        assertThat(guarded.analysis().otherIncomeCommentary()).isEmpty();
        assertThat(guarded.warnings()).hasSize(3)
                .allSatisfy(finding -> assertThat(finding.check()).isEqualTo(BreakdownGuard.CHECK));
    }
}
