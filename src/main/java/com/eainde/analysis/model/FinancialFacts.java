package com.eainde.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.util.List;

/**
 * Figures extracted from a statement by the extraction capability.
 * <p>
 * Every numeric field is nullable and {@code null} always means "not reported". Lists are never null.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FinancialFacts(
        @JsonProperty("company_name") String companyName,
        @JsonProperty("fiscal_year") String fiscalYear,
        String currency,
        PeriodValue revenue,
        @JsonProperty("net_income") Double netIncome,
        @JsonProperty("net_income_previous") Double netIncomePrevious,
        Double eps,
        @JsonProperty("shares_outstanding") Double sharesOutstanding,
        @JsonProperty("book_value_per_share") Double bookValuePerShare,
        @JsonProperty("shareholders_equity") Double shareholdersEquity,
        @JsonProperty("total_assets") Double totalAssets,
        @JsonProperty("total_liabilities") Double totalLiabilities,
        @JsonProperty("current_assets") Double currentAssets,
        @JsonProperty("current_liabilities") Double currentLiabilities,
        Double cash,
        @JsonProperty("accounts_receivable") Double accountsReceivable,
        @JsonProperty("total_debt") Double totalDebt,
        @JsonProperty("operating_income") Double operatingIncome,
        Double ebitda,
        Double cogs,
        @JsonProperty("interest_expense") Double interestExpense,
        @JsonProperty("operating_cash_flow") Double operatingCashFlow,
        @JsonProperty("capital_expenditures") Double capitalExpenditures,
        @JsonProperty("free_cash_flow") Double freeCashFlow,
        @JsonProperty("dividends_paid") Double dividendsPaid,
        @JsonProperty("beginning_cash") Double beginningCash,
        @JsonProperty("ending_cash") Double endingCash,
        @JsonProperty("net_change_in_cash") Double netChangeInCash,
        @JsonProperty("cash_flow_net_income") Double cashFlowNetIncome,
        List<ReportedSegment> segments,
        @JsonProperty("other_income") List<IncomeItem> otherIncome,
        @JsonProperty("investor_statements") List<String> investorStatements) implements Serializable {

    public FinancialFacts {
        revenue = revenue == null ? PeriodValue.unknown() : revenue;
        segments = segments == null ? List.of() : List.copyOf(segments);
        otherIncome = otherIncome == null ? List.of() : List.copyOf(otherIncome);
        investorStatements = investorStatements == null ? List.of() : List.copyOf(investorStatements);
    }

    public Double currentRevenue() {
        return revenue.current();
    }
}
