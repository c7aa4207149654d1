package com.eainde.analysis.stage;

import com.eainde.analysis.model.DerivedMetrics;
import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.ValidationReport;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validate stage body. Cross-checks the extracted statements against each other, and the calculated
 * metrics against the facts they were derived from. It annotates and never changes either.
 * <p>
 * Deviations are measured relative to a base value. When the base is zero the absolute fallback replaces
 * the warning band and the contradiction band scales with it.
 */
@Log4j2
public class ConsistencyChecker {

    static final String FREE_CASH_FLOW = "free-cash-flow";
    static final String BALANCE_SHEET = "balance-sheet";
    static final String CASH_RECONCILIATION = "cash-reconciliation";
    static final String NET_INCOME = "net-income-consistency";
    static final String DERIVED_SHARES = "derived-shares";
    static final String CRITICAL_METRICS = "critical-metrics";

    private final ConsistencyPolicy policy;

    public ConsistencyChecker(ConsistencyPolicy policy) {
        this.policy = policy;
    }

    public ValidationReport check(FinancialFacts facts, DerivedMetrics metrics) {
        List<Finding> findings = new ArrayList<>();
        checkCriticalMetrics(facts, findings);
        checkFreeCashFlow(facts, findings);
        checkBalanceSheet(facts, findings);
        checkCashReconciliation(facts, findings);
        checkNetIncome(facts, findings);
        checkDerivedShares(facts, metrics, findings);
        ValidationReport report = new ValidationReport(findings);
        log.info("Consistency check produced {} warnings and {} contradictions",
                report.warnings().size(), report.contradictions().size());
        return report;
    }

    private void checkCriticalMetrics(FinancialFacts facts, List<Finding> findings) {
        List<String> missing = new ArrayList<>();
        if (facts.currentRevenue() == null) missing.add("revenue");
        if (facts.netIncome() == null) missing.add("net income");
        if (facts.totalAssets() == null) missing.add("total assets");
        if (facts.shareholdersEquity() == null) missing.add("shareholders' equity");
        if (!missing.isEmpty()) {
            findings.add(Finding.warning(CRITICAL_METRICS, "Critical figures not reported: " + String.join(", ", missing)));
        }
    }

    private void checkFreeCashFlow(FinancialFacts facts, List<Finding> findings) {
        Double fcf = facts.freeCashFlow();
        Double ocf = facts.operatingCashFlow();
        Double capex = facts.capitalExpenditures();
        if (fcf == null || ocf == null || capex == null) {
            findings.add(Finding.warning(FREE_CASH_FLOW,
                    "Cannot verify free cash flow: operating cash flow, capital expenditures or free cash flow missing"));
            return;
        }
        compare(FREE_CASH_FLOW, "Free cash flow", fcf, ocf - Math.abs(capex), ocf, true, findings);
    }

    private void checkBalanceSheet(FinancialFacts facts, List<Finding> findings) {
        Double assets = facts.totalAssets();
        Double liabilities = facts.totalLiabilities();
        Double equity = facts.shareholdersEquity();
        if (assets == null || liabilities == null || equity == null) {
            findings.add(Finding.warning(BALANCE_SHEET,
                    "Cannot verify balance sheet: total assets, total liabilities or shareholders' equity missing"));
            return;
        }
        compare(BALANCE_SHEET, "Total assets", assets, liabilities + equity, assets, true, findings);
    }

    private void checkCashReconciliation(FinancialFacts facts, List<Finding> findings) {
        Double beginning = facts.beginningCash();
        Double change = facts.netChangeInCash();
        Double ending = facts.endingCash();
        if (beginning == null || change == null || ending == null) {
            findings.add(Finding.warning(CASH_RECONCILIATION,
                    "Cannot reconcile cash: beginning cash, net change in cash or ending cash missing"));
            return;
        }
        compare(CASH_RECONCILIATION, "Ending cash", ending, beginning + change, beginning, true, findings);
    }

    private void checkNetIncome(FinancialFacts facts, List<Finding> findings) {
        Double incomeStatement = facts.netIncome();
        Double cashFlowStatement = facts.cashFlowNetIncome();
        if (incomeStatement == null || cashFlowStatement == null) {
            findings.add(Finding.warning(NET_INCOME,
                    "Cannot compare net income between income statement and cash flow statement"));
            return;
        }
        compare(NET_INCOME, "Cash flow statement net income", cashFlowStatement, incomeStatement, incomeStatement,
                false, findings);
    }

    private void checkDerivedShares(FinancialFacts facts, DerivedMetrics metrics, List<Finding> findings) {
        Double netIncome = facts.netIncome();
        Double eps = facts.eps();
        if (netIncome == null || eps == null || eps <= 0) {
            return;
        }
        double implied = netIncome / eps;
        Double reported = facts.sharesOutstanding();
        if (reported != null) {
            compare(DERIVED_SHARES, "Reported shares outstanding", reported, implied, reported, false, findings);
            return;
        }
        Double calculated = metrics == null ? null : metrics.sharesOutstanding();
        if (calculated == null) {
            findings.add(Finding.warning(DERIVED_SHARES,
                    "Shares outstanding neither reported nor calculated although net income and EPS are known"));
            return;
        }
        compare(DERIVED_SHARES, "Calculated shares outstanding", calculated, implied, implied, false, findings);
    }

    private void compare(String check, String label, double actual, double expected, double base,
                         boolean mayContradict, List<Finding> findings) {
        double difference = Math.abs(actual - expected);
        double warningLimit;
        double contradictionLimit;
        if (base == 0) {
            warningLimit = policy.absoluteFallback();
            contradictionLimit = policy.warningTolerance() == 0
                    ? policy.absoluteFallback()
                    : policy.absoluteFallback() * policy.contradictionTolerance() / policy.warningTolerance();
        } else {
            warningLimit = Math.abs(base) * policy.warningTolerance();
            contradictionLimit = Math.abs(base) * policy.contradictionTolerance();
        }
        if (difference <= warningLimit) {
            return;
        }
        String message = String.format(Locale.US, "%s %,.2f differs from expected %,.2f by %,.2f",
                label, actual, expected, difference);
        if (mayContradict && difference > contradictionLimit) {
            findings.add(Finding.contradiction(check, message));
        } else {
            findings.add(Finding.warning(check, message));
        }
    }
}
