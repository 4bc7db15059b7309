package com.purchasingpower.copilot.query;

import lombok.Value;

/**
 * Ticker-like token found in a question, with its start index in the uppercased text.
 */
@Value
public class CandidateSymbol {
    String symbol;
    int offset;
}
