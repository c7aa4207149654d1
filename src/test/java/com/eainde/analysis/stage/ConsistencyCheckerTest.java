package com.eainde.analysis.stage;

import com.eainde.analysis.AnalysisFixtures;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.FindingSeverity;
import com.eainde.analysis.model.ValidationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker(ConsistencyPolicy.DEFAULT);
    private final MetricsCalculator calculator = new MetricsCalculator();

    private ValidationReport check(FinancialFacts facts) {
        return checker.check(facts, calculator.calculate(facts, 10.0));
    }

    @Test
    @DisplayName("check() should pass consistent statements without findings")
    void check_shouldReturnNoFindings_whenStatementsAgree() {
        // Act
        ValidationReport report = check(AnalysisFixtures.facts());

        // Assert
        assertThat(report.findings()).isEmpty();
        assertThat(report.hasContradictions()).isFalse();
    }

    @Nested
    @DisplayName("free cash flow")
    class FreeCashFlow {

        @Test
        @DisplayName("should contradict when reported FCF is far from OCF minus capex")
        void check_shouldContradict_whenFcfDeviatesBeyondBand() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().freeCashFlow(200_000_000d).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.contradictions()).singleElement()
                    .extracting(Finding::check).isEqualTo(ConsistencyChecker.FREE_CASH_FLOW);
        }

        @Test
        @DisplayName("should only warn inside the contradiction band")
        void check_shouldWarn_whenFcfDeviatesModerately() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().freeCashFlow(155_000_000d).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.hasContradictions()).isFalse();
            assertThat(report.warnings()).singleElement()
                    .extracting(Finding::check).isEqualTo(ConsistencyChecker.FREE_CASH_FLOW);
        }

        @Test
        @DisplayName("should warn that it cannot verify when an input is missing")
        void check_shouldWarn_whenInputMissing() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().operatingCashFlow(null).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.warnings()).singleElement()
                    .satisfies(finding -> {
                        assertThat(finding.check()).isEqualTo(ConsistencyChecker.FREE_CASH_FLOW);
                        assertThat(finding.message()).startsWith("Cannot verify free cash flow");
                    });
        }
    }

    @Nested
    @DisplayName("balance sheet and cash")
    class BalanceSheetAndCash {

        @Test
        @DisplayName("should warn when assets differ from liabilities plus equity within the band")
        void check_shouldWarn_whenBalanceSheetSlightlyOff() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().totalLiabilities(1_650_000_000d).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.findings()).singleElement()
                    .satisfies(finding -> {
                        assertThat(finding.check()).isEqualTo(ConsistencyChecker.BALANCE_SHEET);
                        assertThat(finding.severity()).isEqualTo(FindingSeverity.WARNING);
                    });
        }

        @Test
        @DisplayName("should use the absolute fallback when beginning cash is zero")
        void check_shouldUseAbsoluteFallback_whenBaseIsZero() {
            // Arrange
            FinancialFacts within = AnalysisFixtures.facts().toBuilder()
                    .beginningCash(0d).netChangeInCash(200_000_000d).endingCash(200_000_500d).build();
            FinancialFacts warning = within.toBuilder().endingCash(200_005_000d).build();
            FinancialFacts contradiction = within.toBuilder().endingCash(200_050_000d).build();

            // Act & Assert
            assertThat(check(within).findings()).isEmpty();
            assertThat(check(warning).warnings()).extracting(Finding::check)
                    .containsExactly(ConsistencyChecker.CASH_RECONCILIATION);
            assertThat(check(contradiction).contradictions()).extracting(Finding::check)
                    .containsExactly(ConsistencyChecker.CASH_RECONCILIATION);
        }
    }

    @Nested
    @DisplayName("warning-only checks")
    class WarningOnly {

        @Test
        @DisplayName("should never contradict on a net income mismatch")
        void check_shouldOnlyWarn_onNetIncomeMismatch() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().cashFlowNetIncome(100_000_000d).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.hasContradictions()).isFalse();
            assertThat(report.warnings()).extracting(Finding::check).containsExactly(ConsistencyChecker.NET_INCOME);
        }

        @Test
        @DisplayName("should warn when reported shares disagree with net income over EPS")
        void check_shouldWarn_onDerivedSharesMismatch() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().sharesOutstanding(50_000_000d).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.hasContradictions()).isFalse();
            assertThat(report.warnings()).extracting(Finding::check).containsExactly(ConsistencyChecker.DERIVED_SHARES);
        }

        @Test
        @DisplayName("should check the calculated share count when shares were not reported")
        void check_shouldWarn_whenCalculatedSharesDisagreeWithInputs() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().sharesOutstanding(null).build();
            DerivedMetrics calculated = calculator.calculate(facts, 10.0);
            DerivedMetrics skewed = calculated.toBuilder().sharesOutstanding(calculated.sharesOutstanding() * 2).build();

            // Act
            ValidationReport consistent = checker.check(facts, calculated);
            ValidationReport inconsistent = checker.check(facts, skewed);

            // Assert
            assertThat(calculated.sharesOutstanding()).isNotNull();
            assertThat(consistent.findings()).isEmpty();
            assertThat(inconsistent.hasContradictions()).isFalse();
            assertThat(inconsistent.warnings()).singleElement().satisfies(finding -> {
                assertThat(finding.check()).isEqualTo(ConsistencyChecker.DERIVED_SHARES);
                assertThat(finding.message()).startsWith("Calculated shares outstanding");
            });
        }

        @Test
        @DisplayName("should list unreported critical figures")
        void check_shouldWarn_onMissingCriticalFigures() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().totalAssets(null).build();

            // Act
            ValidationReport report = check(facts);

            // Assert
            assertThat(report.warnings()).extracting(Finding::check)
                    .containsExactly(ConsistencyChecker.CRITICAL_METRICS, ConsistencyChecker.BALANCE_SHEET);
            assertThat(report.warnings().get(0).message()).contains("total assets");
        }
    }

    @Test
    @DisplayName("ConsistencyPolicy should reject a contradiction band narrower than the warning band")
    void policy_shouldRejectInvertedBands() {
        assertThatThrownBy(() -> new ConsistencyPolicy(0.10, 0.01, 1000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
