package com.purchasingpower.copilot.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword rules over the lowercased question. First category with a matching keyword wins;
 * keywords match as substrings, so "taxes" counts as "tax".
 */
@Component
public class QueryCategorizer {

    private static final Map<QueryCategory, List<String>> RULES = ImmutableMap.of(
            QueryCategory.INVESTMENT_ADVICE, ImmutableList.of("investment", "portfolio", "asset"),
            QueryCategory.RETIREMENT_PLANNING, ImmutableList.of("retirement", "planning", "future"),
            QueryCategory.TAX_PLANNING, ImmutableList.of("tax", "taxation", "deduction"),
            QueryCategory.RISK_MANAGEMENT, ImmutableList.of("risk", "volatility", "diversification"),
            QueryCategory.MARKET_ANALYSIS, ImmutableList.of("market", "stock", "trading"));

    public QueryCategory categorize(String question) {
        Preconditions.checkNotNull(question, "Question cannot be null");
        String lower = question.toLowerCase(Locale.ROOT);

        return RULES.entrySet().stream()
                .filter(rule -> rule.getValue().stream().anyMatch(lower::contains))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(QueryCategory.GENERAL_ADVICE);
    }
}
