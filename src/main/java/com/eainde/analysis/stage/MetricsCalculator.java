package com.eainde.analysis.stage;

import com.eainde.analysis.error.CalculationException;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.IncomeItem;
import com.eainde.analysis.model.IncomeShare;
import com.eainde.analysis.model.ReportedSegment;
import com.eainde.analysis.model.SegmentShare;

import java.util.List;

/**
 * Calculate stage body. Pure function of the extracted facts and the market price.
 * <p>
 * A metric is {@code null} whenever one of its inputs is unknown or its denominator is not usable:
 * zero always, and anything not positive for per-share figures, price multiples, growth rates and
 * ratios over revenue, equity, assets or current liabilities. Nothing is rounded here.
 */
public class MetricsCalculator {

    public DerivedMetrics calculate(FinancialFacts facts, Double stockPrice) {
        Double price = positive(stockPrice) ? stockPrice : null;
        Double revenue = facts.currentRevenue();
        Double netIncome = facts.netIncome();
        Double equity = facts.shareholdersEquity();

        Double derivedShares = facts.sharesOutstanding() == null ? perPositive(netIncome, facts.eps()) : null;
        Double shares = facts.sharesOutstanding() != null ? facts.sharesOutstanding() : derivedShares;
        Double marketCap = positive(shares) ? multiply(price, shares) : null;
        Double derivedBookValue = facts.bookValuePerShare() == null ? perPositive(equity, shares) : null;
        Double bookValue = facts.bookValuePerShare() != null ? facts.bookValuePerShare() : derivedBookValue;

        Double enterpriseValue = marketCap == null || facts.totalDebt() == null || facts.cash() == null
                ? null
                : marketCap + facts.totalDebt() - facts.cash();

        DerivedMetrics metrics = DerivedMetrics.builder()
                .sharesOutstanding(derivedShares)
                .marketCap(marketCap)
                .bookValuePerShare(derivedBookValue)
                .peRatio(perPositive(price, facts.eps()))
                .pbRatio(perPositive(price, bookValue))
                .psRatio(perPositive(marketCap, revenue))
                .evEbitda(perPositive(enterpriseValue, facts.ebitda()))
                .fcfYield(percent(facts.freeCashFlow(), marketCap))
                .revenueGrowthPct(growth(revenue, facts.revenue().previous()))
                .netIncomeGrowthPct(growth(netIncome, facts.netIncomePrevious()))
                .roe(percent(netIncome, equity))
                .roa(percent(netIncome, facts.totalAssets()))
                .debtToEquity(perPositive(facts.totalDebt(), equity))
                .currentRatio(perPositive(facts.currentAssets(), facts.currentLiabilities()))
                .workingCapital(facts.currentAssets() == null || facts.currentLiabilities() == null
                        ? null
                        : facts.currentAssets() - facts.currentLiabilities())
                .operatingMargin(percent(facts.operatingIncome(), revenue))
                .netMargin(percent(netIncome, revenue))
                .capexPctRevenue(percent(abs(facts.capitalExpenditures()), revenue))
                .payoutRatio(percent(abs(facts.dividendsPaid()), netIncome))
                .fcfCoverage(per(facts.freeCashFlow(), abs(facts.dividendsPaid())))
                .cashPerShare(perPositive(facts.cash(), shares))
                .debtToAssets(perPositive(facts.totalDebt(), facts.totalAssets()))
                .quickRatio(perPositive(facts.cash() == null || facts.accountsReceivable() == null
                        ? null
                        : facts.cash() + facts.accountsReceivable(), facts.currentLiabilities()))
                .grossMarginPct(revenue == null || facts.cogs() == null ? null : percent(revenue - facts.cogs(), revenue))
                .interestCoverage(perPositive(facts.operatingIncome(), facts.interestExpense()))
                .segmentComposition(segmentComposition(facts.segments(), revenue, facts.operatingIncome()))
                .incomeComposition(incomeComposition(facts.otherIncome(), netIncome))
                .build();

        requireFinite(metrics);
        return metrics;
    }

    private static List<SegmentShare> segmentComposition(List<ReportedSegment> segments, Double revenue,
                                                         Double operatingIncome) {
        return segments.stream()
                .map(segment -> new SegmentShare(
                        segment.name(),
                        percent(segment.revenue(), revenue),
                        percent(segment.operatingIncome(), operatingIncome)))
                .toList();
    }

    private static List<IncomeShare> incomeComposition(List<IncomeItem> items, Double netIncome) {
        return items.stream()
                .map(item -> new IncomeShare(item.name(), percent(item.amount(), netIncome)))
                .toList();
    }

    private static void requireFinite(DerivedMetrics metrics) {
        Double[] values = {
                metrics.sharesOutstanding(), metrics.marketCap(), metrics.bookValuePerShare(), metrics.peRatio(),
                metrics.pbRatio(), metrics.psRatio(), metrics.evEbitda(), metrics.fcfYield(),
                metrics.revenueGrowthPct(), metrics.netIncomeGrowthPct(), metrics.roe(), metrics.roa(),
                metrics.debtToEquity(), metrics.currentRatio(), metrics.workingCapital(), metrics.operatingMargin(),
                metrics.netMargin(), metrics.capexPctRevenue(), metrics.payoutRatio(), metrics.fcfCoverage(),
                metrics.cashPerShare(), metrics.debtToAssets(), metrics.quickRatio(), metrics.grossMarginPct(),
                metrics.interestCoverage()
        };
        for (Double value : values) {
            if (value != null && !Double.isFinite(value)) {
                throw new CalculationException("Derived metric is not a finite number: " + value);
            }
        }
        for (SegmentShare share : metrics.segmentComposition()) {
            if (!finiteOrNull(share.revenueSharePct()) || !finiteOrNull(share.operatingIncomeSharePct())) {
                throw new CalculationException("Segment share of " + share.name() + " is not a finite number");
            }
        }
        for (IncomeShare share : metrics.incomeComposition()) {
            if (!finiteOrNull(share.netIncomeSharePct())) {
                throw new CalculationException("Income share of " + share.name() + " is not a finite number");
            }
        }
    }

    private static boolean finiteOrNull(Double value) {
        return value == null || Double.isFinite(value);
    }

    private static boolean positive(Double value) {
        return value != null && value > 0;
    }

    private static Double abs(Double value) {
        return value == null ? null : Math.abs(value);
    }

    private static Double multiply(Double a, Double b) {
        return a == null || b == null ? null : a * b;
    }

    private static Double per(Double numerator, Double denominator) {
        return numerator == null || denominator == null || denominator == 0 ? null : numerator / denominator;
    }

    private static Double perPositive(Double numerator, Double denominator) {
        return numerator == null || !positive(denominator) ? null : numerator / denominator;
    }

    private static Double percent(Double numerator, Double denominator) {
        Double ratio = perPositive(numerator, denominator);
        return ratio == null ? null : ratio * 100;
    }

    private static Double growth(Double current, Double previous) {
        return current == null || !positive(previous) ? null : (current - previous) / previous * 100;
    }
}
