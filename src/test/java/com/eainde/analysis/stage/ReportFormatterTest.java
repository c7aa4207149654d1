package com.eainde.analysis.stage;

import com.eainde.analysis.AnalysisFixtures;
import com.eainde.analysis.error.ReportFormatException;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.InvestorAnalysis;
import com.eainde.analysis.model.UsageCounters;
import com.eainde.analysis.model.UsageSummary;
import com.eainde.analysis.model.ValidationReport;
import com.eainde.analysis.state.StageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportFormatterTest {

    private final ReportFormatter formatter = new ReportFormatter();
    private final FinancialFacts facts = AnalysisFixtures.facts();
    private final UsageSummary usage = new UsageSummary(
            Map.of(StageName.EXTRACT, new UsageCounters(1000, 500, 1500, 0.00045)),
            new UsageCounters(1000, 500, 1500, 0.00045));

    private GuardedAnalysis analysis(List<Finding> guardWarnings) {
        return new GuardedAnalysis(InvestorAnalysis.builder()
                .companyType("operating")
                .investorSummary("Steady growth.")
                .redFlags(List.of("Rising debt"))
                .build(), guardWarnings);
    }

    @Nested
    @DisplayName("format()")
    class Format {

        @Test
        @DisplayName("should print the derived share count rounded to whole shares")
        void format_shouldContainDerivedShares() {
            // Arrange
            DerivedMetrics metrics = new MetricsCalculator().calculate(facts, 50.0);

            // Act
            AnalysisReport report = formatter.format("ACME", facts, metrics, new ValidationReport(List.of()),
                    analysis(List.of()), usage);

            // Assert
            assertThat(report.text())
                    .contains("- Shares Outstanding: 42,857,143")
                    .contains("- Revenue (current): 1,000,000,000")
                    .contains("- P/E Ratio: 14.29")
                    .contains("- Revenue Growth: 5.3%")
                    .contains("- Rising debt");
            assertThat(report.companyName()).isEqualTo("Acme Industries Limited");
            assertThat(report.usage()).isEqualTo(usage);
        }

        @Test
        @DisplayName("should render unknown values as N/A")
        void format_shouldRenderUnknownAsNotAvailable() {
            // Arrange
            DerivedMetrics metrics = new MetricsCalculator().calculate(facts, null);

            // Act
            AnalysisReport report = formatter.format("ACME", facts, metrics, new ValidationReport(List.of()),
                    analysis(List.of()), usage);

            // Assert
            assertThat(report.text())
                    .contains("- Market Cap: N/A")
                    .contains("- P/E Ratio: N/A")
                    .contains("- Investment Trend: N/A");
        }

        @Test
        @DisplayName("should list consistency and breakdown warnings together")
        void format_shouldMergeWarnings() {
            // Arrange
            DerivedMetrics metrics = new MetricsCalculator().calculate(facts, 50.0);
            Finding consistency = Finding.warning("net-income-consistency", "Net income differs");
            Finding guard = Finding.warning(BreakdownGuard.CHECK, "Removed commentary on segment 'Textiles'");

            // Act
            AnalysisReport report = formatter.format("ACME", facts, metrics,
                    new ValidationReport(List.of(consistency)), analysis(List.of(guard)), usage);

            // Assert
            assertThat(report.warnings()).containsExactly(consistency, guard);
            assertThat(report.text())
                    .contains("[net-income-consistency] Net income differs")
                    .contains("[breakdown-guard] Removed commentary on segment 'Textiles'");
        }

        @Test
        @DisplayName("should fail when an upstream payload is missing")
        void format_shouldRejectMissingPayload() {
            assertThatThrownBy(() -> formatter.format("ACME", facts, null, new ValidationReport(List.of()),
                    analysis(List.of()), usage))
                    .isInstanceOf(ReportFormatException.class);
        }
    }

    @Test
    @DisplayName("number helpers should round only for display")
    void helpers_shouldRoundForDisplay() {
        assertThat(ReportFormatter.amount(1234567.5)).isEqualTo("1,234,568");
        assertThat(ReportFormatter.ratio(0.456)).isEqualTo("0.46");
        assertThat(ReportFormatter.percent(12.345)).isEqualTo("12.3%");
        assertThat(ReportFormatter.amount(null)).isEqualTo(ReportFormatter.NOT_AVAILABLE);
    }
}
