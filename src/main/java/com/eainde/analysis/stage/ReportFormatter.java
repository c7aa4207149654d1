package com.eainde.analysis.stage;

import com.eainde.analysis.error.ReportFormatException;
import com.eainde.analysis.model.AnalysisReport;
import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.IncomeShare;
import com.eainde.analysis.model.InvestorAnalysis;
import com.eainde.analysis.model.ReportedSegment;
import com.eainde.analysis.model.SegmentShare;
import com.eainde.analysis.model.UsageCounters;
import com.eainde.analysis.model.UsageSummary;
import com.eainde.analysis.model.ValidationReport;
import com.eainde.analysis.state.StageName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Format stage body. Deterministic; the only place where numbers are rounded.
 * <p>
 * Amounts get thousands separators and no decimals, ratios two decimals, percentages one decimal.
 * Unknown values print as {@code N/A}.
 */
public class ReportFormatter {

    static final String NOT_AVAILABLE = "N/A";

    public AnalysisReport format(String subject, FinancialFacts facts, DerivedMetrics metrics,
                                 ValidationReport validation, GuardedAnalysis guarded, UsageSummary usage) {
        if (facts == null || metrics == null || validation == null || guarded == null || guarded.analysis() == null) {
            throw new ReportFormatException("Cannot format report for " + subject + ": a stage payload is missing");
        }
        InvestorAnalysis analysis = guarded.analysis();
        List<Finding> warnings = new ArrayList<>(validation.warnings());
        warnings.addAll(guarded.warnings());

        List<String> lines = new ArrayList<>();
        lines.add("INVESTOR ANALYSIS REPORT: " + subject);
        lines.add("");

        section(lines, "COMPANY INFORMATION");
        lines.add("- Company Name: " + text(facts.companyName()));
        lines.add("- Fiscal Year: " + text(facts.fiscalYear()));
        lines.add("- Currency: " + text(facts.currency()));
        lines.add("- Company Type: " + text(analysis.companyType()));

        section(lines, "BUSINESS SEGMENTS");
        if (facts.segments().isEmpty()) {
            lines.add("- No segment breakdown reported");
        }
        for (ReportedSegment segment : facts.segments()) {
            lines.add("- " + text(segment.name()) + ": " + text(segment.description())
                    + " (revenue " + amount(segment.revenue()) + ", operating income "
                    + amount(segment.operatingIncome()) + ")");
        }

        list(lines, "KEY INVESTOR STATEMENTS", facts.investorStatements());

        section(lines, "GROWTH METRICS");
        metric(lines, "Revenue (current)", amount(facts.currentRevenue()));
        metric(lines, "Revenue (previous)", amount(facts.revenue().previous()));
        metric(lines, "Revenue Growth", percent(metrics.revenueGrowthPct()));
        metric(lines, "Net Income", amount(facts.netIncome()));
        metric(lines, "Net Income Growth", percent(metrics.netIncomeGrowthPct()));

        section(lines, "VALUATION METRICS");
        metric(lines, "EPS", ratio(facts.eps()));
        metric(lines, "Shares Outstanding", amount(facts.sharesOutstanding() != null
                ? facts.sharesOutstanding() : metrics.sharesOutstanding()));
        metric(lines, "Market Cap", amount(metrics.marketCap()));
        metric(lines, "Book Value per Share", ratio(facts.bookValuePerShare() != null
                ? facts.bookValuePerShare() : metrics.bookValuePerShare()));
        metric(lines, "P/E Ratio", ratio(metrics.peRatio()));
        metric(lines, "P/B Ratio", ratio(metrics.pbRatio()));
        metric(lines, "P/S Ratio", ratio(metrics.psRatio()));
        metric(lines, "EV/EBITDA", ratio(metrics.evEbitda()));
        metric(lines, "FCF Yield", percent(metrics.fcfYield()));

        section(lines, "FINANCIAL HEALTH");
        metric(lines, "ROE", percent(metrics.roe()));
        metric(lines, "ROA", percent(metrics.roa()));
        metric(lines, "Debt/Equity", ratio(metrics.debtToEquity()));
        metric(lines, "Debt/Assets", ratio(metrics.debtToAssets()));
        metric(lines, "Current Ratio", ratio(metrics.currentRatio()));
        metric(lines, "Quick Ratio", ratio(metrics.quickRatio()));
        metric(lines, "Working Capital", amount(metrics.workingCapital()));
        metric(lines, "Gross Margin", percent(metrics.grossMarginPct()));
        metric(lines, "Operating Margin", percent(metrics.operatingMargin()));
        metric(lines, "Net Margin", percent(metrics.netMargin()));
        metric(lines, "Interest Coverage", ratio(metrics.interestCoverage()));
        metric(lines, "Cash per Share", ratio(metrics.cashPerShare()));

        section(lines, "INVESTMENT AND DIVIDENDS");
        metric(lines, "Capital Expenditures", amount(facts.capitalExpenditures()));
        metric(lines, "CapEx as % of Revenue", percent(metrics.capexPctRevenue()));
        metric(lines, "Investment Trend", text(analysis.investmentTrend()));
        metric(lines, "Dividends Paid", amount(facts.dividendsPaid()));
        metric(lines, "Payout Ratio", percent(metrics.payoutRatio()));
        metric(lines, "FCF Coverage", ratio(metrics.fcfCoverage()));
        metric(lines, "Dividend Strategy", text(analysis.dividendStrategy()));

        section(lines, "SEGMENT AND INCOME COMPOSITION");
        for (SegmentShare share : metrics.segmentComposition()) {
            lines.add("- " + text(share.name()) + ": " + percent(share.revenueSharePct()) + " of revenue, "
                    + percent(share.operatingIncomeSharePct()) + " of operating income");
        }
        for (IncomeShare share : metrics.incomeComposition()) {
            lines.add("- " + text(share.name()) + ": " + percent(share.netIncomeSharePct()) + " of net income");
        }
        analysis.segmentCommentary().forEach(c -> lines.add("- " + c.segment() + ": " + c.commentary()));
        analysis.otherIncomeCommentary().forEach(c -> lines.add("- " + c.item() + ": " + c.commentary()));
        if (metrics.segmentComposition().isEmpty() && metrics.incomeComposition().isEmpty()) {
            lines.add("- No breakdown reported");
        }

        list(lines, "INVESTMENT GROWTH AREAS", analysis.growthAreas());
        list(lines, "HOLDING FOCUS AREAS", analysis.holdingFocusAreas());
        list(lines, "LOSS-CAUSING AREAS", analysis.lossAreas());
        list(lines, "NEW INITIATIVES", analysis.newInitiatives());

        section(lines, "INVESTOR SUMMARY");
        lines.add(text(analysis.investorSummary()));

        list(lines, "RED FLAGS", analysis.redFlags());
        list(lines, "CONSISTENCY WARNINGS", warnings.stream().map(w -> "[" + w.check() + "] " + w.message()).toList());

        section(lines, "USAGE");
        for (Map.Entry<StageName, UsageCounters> entry : usage.stages().entrySet()) {
            lines.add("- " + entry.getKey() + ": " + usage(entry.getValue()));
        }
        lines.add("- TOTAL: " + usage(usage.total()));

        return new AnalysisReport(subject, facts.companyName(), facts.fiscalYear(), facts.currency(),
                String.join("\n", lines), warnings, usage);
    }

    static String amount(Double value) {
        return value == null ? NOT_AVAILABLE : String.format(Locale.US, "%,.0f", value);
    }

    static String ratio(Double value) {
        return value == null ? NOT_AVAILABLE : String.format(Locale.US, "%,.2f", value);
    }

    static String percent(Double value) {
        return value == null ? NOT_AVAILABLE : String.format(Locale.US, "%.1f%%", value);
    }

    private static String usage(UsageCounters counters) {
        return String.format(Locale.US, "%,d prompt + %,d completion = %,d tokens, $%.6f",
                counters.promptTokens(), counters.completionTokens(), counters.totalTokens(), counters.costUsd());
    }

    private static String text(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }

    private static void section(List<String> lines, String title) {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
        lines.add(title);
    }

    private static void metric(List<String> lines, String label, String value) {
        lines.add("- " + label + ": " + value);
    }

    private static void list(List<String> lines, String title, List<String> items) {
        section(lines, title);
        if (items.isEmpty()) {
            lines.add("- None");
        }
        items.forEach(item -> lines.add("- " + item));
    }
}
