package com.purchasingpower.copilot.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Query Categorizer Tests")
class QueryCategorizerTest {

    private final QueryCategorizer categorizer = new QueryCategorizer();

    @Test
    @DisplayName("Should apply the first matching rule")
    void testCategorize_FirstMatchWins() {
        assertEquals(QueryCategory.INVESTMENT_ADVICE, categorizer.categorize("investment retirement planning"));
    }

    @Test
    @DisplayName("Should map keywords to categories")
    void testCategorize_Keywords() {
        assertEquals(QueryCategory.INVESTMENT_ADVICE, categorizer.categorize("Review my Portfolio"));
        assertEquals(QueryCategory.RETIREMENT_PLANNING, categorizer.categorize("When can I retire? Retirement age"));
        assertEquals(QueryCategory.TAX_PLANNING, categorizer.categorize("Can I claim a deduction?"));
        assertEquals(QueryCategory.RISK_MANAGEMENT, categorizer.categorize("How do I handle volatility?"));
        assertEquals(QueryCategory.MARKET_ANALYSIS, categorizer.categorize("Is the stock up today?"));
        assertEquals(QueryCategory.GENERAL_ADVICE, categorizer.categorize("Hello there"));
    }

    @Test
    @DisplayName("Should match keywords as substrings")
    void testCategorize_Substrings() {
        assertEquals(QueryCategory.TAX_PLANNING, categorizer.categorize("Are dividends taxes?"));
        assertEquals(QueryCategory.MARKET_ANALYSIS, categorizer.categorize("stockpicking tips"));
    }

    @Test
    @DisplayName("Should expose wire values")
    void testCategory_WireValue() {
        assertEquals("retirement_planning", QueryCategory.RETIREMENT_PLANNING.getValue());
        assertEquals("general_advice", QueryCategory.GENERAL_ADVICE.toString());
    }
}
