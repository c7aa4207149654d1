package com.eainde.analysis.stage;

import com.eainde.analysis.model.FinancialFacts;
import com.eainde.analysis.model.Finding;
import com.eainde.analysis.model.GuardedAnalysis;
import com.eainde.analysis.model.IncomeCommentary;
import com.eainde.analysis.model.IncomeItem;
import com.eainde.analysis.model.InvestorAnalysis;
import com.eainde.analysis.model.ReportedSegment;
import com.eainde.analysis.model.SegmentCommentary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drops segment and other-income commentary whose subject is not among the extracted breakdowns.
 * Names are compared trimmed and case-insensitively.
 */
public class BreakdownGuard {

    static final String CHECK = "breakdown-guard";

    public GuardedAnalysis apply(InvestorAnalysis analysis, FinancialFacts facts) {
        Set<String> segments = names(facts.segments().stream().map(ReportedSegment::name).toList());
        Set<String> items = names(facts.otherIncome().stream().map(IncomeItem::name).toList());
        List<Finding> warnings = new ArrayList<>();

        List<SegmentCommentary> keptSegments = new ArrayList<>();
        for (SegmentCommentary commentary : analysis.segmentCommentary()) {
            if (segments.contains(normalize(commentary.segment()))) {
                keptSegments.add(commentary);
            } else {
                warnings.add(Finding.warning(CHECK, "Removed commentary on segment '" + commentary.segment()
                        + "' that is not among the reported segments"));
            }
        }

        List<IncomeCommentary> keptItems = new ArrayList<>();
        for (IncomeCommentary commentary : analysis.otherIncomeCommentary()) {
            if (items.contains(normalize(commentary.item()))) {
                keptItems.add(commentary);
            } else {
                warnings.add(Finding.warning(CHECK, "Removed commentary on income item '" + commentary.item()
                        + "' that is not among the itemized other income"));
            }
        }

        InvestorAnalysis guarded = analysis.toBuilder()
                .segmentCommentary(keptSegments)
                .otherIncomeCommentary(keptItems)
                .build();
        return new GuardedAnalysis(guarded, warnings);
    }

    private static Set<String> names(List<String> names) {
        return names.stream().map(BreakdownGuard::normalize).collect(Collectors.toSet());
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
