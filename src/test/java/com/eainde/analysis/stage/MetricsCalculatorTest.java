package com.eainde.analysis.stage;

import com.eainde.analysis.AnalysisFixtures;
import com.eainde.analysis.error.CalculationException;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.PeriodValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();

    @Nested
    @DisplayName("calculate() with complete statements")
    class CompleteStatements {

        @Test
        @DisplayName("should derive shares outstanding from net income and EPS")
        void calculate_shouldDeriveSharesFromNetIncomeAndEps() {
            // Act
            DerivedMetrics metrics = calculator.calculate(AnalysisFixtures.facts(), 50.0);

            // Assert
            assertThat(metrics.sharesOutstanding()).isCloseTo(42_857_142.857, within(0.001));
            assertThat(metrics.marketCap()).isCloseTo(2_142_857_142.857, within(0.01));
            assertThat(metrics.bookValuePerShare()).isCloseTo(28.0, within(1e-9));
        }

        @Test
        @DisplayName("should compute valuation multiples from the stock price")
        void calculate_shouldComputeValuationMultiples() {
            // Act
            DerivedMetrics metrics = calculator.calculate(AnalysisFixtures.facts(), 50.0);

            // Assert
            assertThat(metrics.peRatio()).isCloseTo(14.2857, within(1e-4));
            assertThat(metrics.pbRatio()).isCloseTo(1.7857, within(1e-4));
            assertThat(metrics.psRatio()).isCloseTo(2.142857, within(1e-6));
            assertThat(metrics.evEbitda()).isCloseTo(8.4762, within(1e-4));
            assertThat(metrics.fcfYield()).isCloseTo(7.0, within(1e-9));
        }

        @Test
        @DisplayName("should compute growth, profitability and health ratios")
        void calculate_shouldComputeRatios() {
            // Act
            DerivedMetrics metrics = calculator.calculate(AnalysisFixtures.facts(), 50.0);

            // Assert
            assertThat(metrics.revenueGrowthPct()).isCloseTo(5.2632, within(1e-4));
            assertThat(metrics.netIncomeGrowthPct()).isCloseTo(25.0, within(1e-9));
            assertThat(metrics.roe()).isCloseTo(12.5, within(1e-9));
            assertThat(metrics.roa()).isCloseTo(5.0, within(1e-9));
            assertThat(metrics.debtToEquity()).isCloseTo(0.5, within(1e-9));
            assertThat(metrics.currentRatio()).isCloseTo(1.6, within(1e-9));
            assertThat(metrics.workingCapital()).isEqualTo(300_000_000d);
            assertThat(metrics.operatingMargin()).isCloseTo(22.0, within(1e-9));
            assertThat(metrics.netMargin()).isCloseTo(15.0, within(1e-9));
            assertThat(metrics.grossMarginPct()).isCloseTo(40.0, within(1e-9));
            assertThat(metrics.quickRatio()).isCloseTo(0.7, within(1e-9));
            assertThat(metrics.debtToAssets()).isCloseTo(0.2, within(1e-9));
            assertThat(metrics.interestCoverage()).isCloseTo(5.5, within(1e-9));
        }

        @Test
        @DisplayName("should treat capex and dividends as outflows regardless of sign")
        void calculate_shouldUseAbsoluteOutflows() {
            // Act
            DerivedMetrics metrics = calculator.calculate(AnalysisFixtures.facts(), 50.0);

            // Assert
            assertThat(metrics.capexPctRevenue()).isCloseTo(10.0, within(1e-9));
            assertThat(metrics.payoutRatio()).isCloseTo(40.0, within(1e-9));
            assertThat(metrics.fcfCoverage()).isCloseTo(2.5, within(1e-9));
        }

        @Test
        @DisplayName("should express segments and other income as shares of their totals")
        void calculate_shouldComputeComposition() {
            // Act
            DerivedMetrics metrics = calculator.calculate(AnalysisFixtures.facts(), 50.0);

            // Assert
            assertThat(metrics.segmentComposition()).hasSize(2);
            assertThat(metrics.segmentComposition().get(0).name()).isEqualTo("Cement");
            assertThat(metrics.segmentComposition().get(0).revenueSharePct()).isCloseTo(60.0, within(1e-9));
            assertThat(metrics.segmentComposition().get(0).operatingIncomeSharePct()).isCloseTo(68.18, within(0.01));
            assertThat(metrics.incomeComposition()).singleElement()
                    .satisfies(share -> assertThat(share.netIncomeSharePct()).isCloseTo(6.667, within(0.001)));
        }

        @Test
        @DisplayName("should not derive figures that were reported")
        void calculate_shouldKeepReportedShares() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder()
                    .sharesOutstanding(40_000_000d)
                    .bookValuePerShare(30.0)
                    .build();

            // Act
            DerivedMetrics metrics = calculator.calculate(facts, 50.0);

            // Assert
            assertThat(metrics.sharesOutstanding()).isNull();
            assertThat(metrics.bookValuePerShare()).isNull();
            assertThat(metrics.marketCap()).isEqualTo(2_000_000_000d);
            assertThat(metrics.pbRatio()).isCloseTo(50.0 / 30.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("calculate() with missing inputs")
    class MissingInputs {

        @Test
        @DisplayName("should leave every market-based metric unknown without a stock price")
        void calculate_shouldPropagateMissingPrice() {
            // Act
            DerivedMetrics metrics = calculator.calculate(AnalysisFixtures.facts(), null);

            // Assert
            assertThat(metrics.marketCap()).isNull();
            assertThat(metrics.peRatio()).isNull();
            assertThat(metrics.pbRatio()).isNull();
            assertThat(metrics.psRatio()).isNull();
            assertThat(metrics.evEbitda()).isNull();
            assertThat(metrics.fcfYield()).isNull();
            assertThat(metrics.roe()).isNotNull();
        }

        @Test
        @DisplayName("should leave per-share metrics unknown when shares cannot be determined")
        void calculate_shouldPropagateUnknownShares() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().eps(null).build();

            // Act
            DerivedMetrics metrics = calculator.calculate(facts, 50.0);

            // Assert
            assertThat(metrics.sharesOutstanding()).isNull();
            assertThat(metrics.marketCap()).isNull();
            assertThat(metrics.cashPerShare()).isNull();
            assertThat(metrics.bookValuePerShare()).isNull();
            assertThat(metrics.peRatio()).isNull();
        }

        @Test
        @DisplayName("should never divide by a zero or negative base")
        void calculate_shouldRejectUnusableDenominators() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder()
                    .revenue(new PeriodValue(0d, 0d))
                    .shareholdersEquity(-10d)
                    .dividendsPaid(0d)
                    .build();

            // Act
            DerivedMetrics metrics = calculator.calculate(facts, 50.0);

            // Assert
            assertThat(metrics.revenueGrowthPct()).isNull();
            assertThat(metrics.netMargin()).isNull();
            assertThat(metrics.operatingMargin()).isNull();
            assertThat(metrics.roe()).isNull();
            assertThat(metrics.debtToEquity()).isNull();
            assertThat(metrics.fcfCoverage()).isNull();
        }

        @Test
        @DisplayName("should require both cash and receivables for the quick ratio")
        void calculate_shouldNotAssumeZeroCash() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder().cash(null).build();

            // Act
            DerivedMetrics metrics = calculator.calculate(facts, 50.0);

            // Assert
            assertThat(metrics.quickRatio()).isNull();
            assertThat(metrics.evEbitda()).isNull();
        }

        @Test
        @DisplayName("should produce empty compositions for empty breakdowns")
        void calculate_shouldHandleEmptySegments() {
            // Arrange
            FinancialFacts facts = AnalysisFixtures.facts().toBuilder()
                    .segments(List.of())
                    .otherIncome(List.of())
                    .build();

            // Act
            DerivedMetrics metrics = calculator.calculate(facts, 50.0);

            // Assert
            assertThat(metrics.segmentComposition()).isEmpty();
            assertThat(metrics.incomeComposition()).isEmpty();
        }
    }

    @Test
    @DisplayName("calculate() should fail on a non-finite result")
    void calculate_shouldRejectNonFiniteValues() {
        // Arrange
        FinancialFacts facts = AnalysisFixtures.facts().toBuilder()
                .netIncome(Double.MAX_VALUE)
                .netIncomePrevious(Double.MIN_VALUE)
                .build();

        // Act & Assert
        assertThatThrownBy(() -> calculator.calculate(facts, 50.0))
                .isInstanceOf(CalculationException.class)
                .hasMessageContaining("not a finite number");
    }
}
