package com.purchasingpower.copilot.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse intent of a question, used for usage analytics.
 */
public enum QueryCategory {

    INVESTMENT_ADVICE("investment_advice"),
    RETIREMENT_PLANNING("retirement_planning"),
    TAX_PLANNING("tax_planning"),
    RISK_MANAGEMENT("risk_management"),
    MARKET_ANALYSIS("market_analysis"),
    GENERAL_ADVICE("general_advice");

    private final String value;

    QueryCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
