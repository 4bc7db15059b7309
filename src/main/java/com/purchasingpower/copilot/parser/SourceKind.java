package com.purchasingpower.copilot.parser;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.Locale;

/**
 * Format family of a raw context blob.
 *
 * <p>The kind selects both the extraction rules and the display template. Every blob maps to
 * exactly one kind; blobs no rule recognises are {@link #UNKNOWN}.
 */
public enum SourceKind {

    /**
     * Web search results (Tavily), one {@code <result>} block per hit.
     */
    SEARCH("tavily", "results"),

    /**
     * Academic paper listings (ArXiv), one paragraph per paper.
     */
    ACADEMIC_PAPER("arxiv", "papers"),

    /**
     * Market data quotes (yfinance), one {@code Stock:} block per symbol.
     */
    MARKET_DATA("yfinance", "stocks"),

    /**
     * Knowledge base interactions, one {@code Interaction:} block per exchange.
     */
    KNOWLEDGE_INTERACTION("ai_rag", "interactions"),

    UNKNOWN("unknown", null);

    private final String sourceId;
    private final String recordsKey;

    SourceKind(String sourceId, String recordsKey) {
        this.sourceId = sourceId;
        this.recordsKey = recordsKey;
    }

    /**
     * Identifier used in the {@code source} field of parse responses.
     */
    @JsonValue
    public String getSourceId() {
        return sourceId;
    }

    /**
     * Key under which parse responses list this kind's records ({@code total_<key>} holds the
     * count). {@code null} for {@link #UNKNOWN}, which has no records.
     */
    public String getRecordsKey() {
        return recordsKey;
    }

    /**
     * Resolve an explicit source hint, accepting either the source id ("tavily") or the constant
     * name ("SEARCH"), case-insensitive.
     *
     * @throws IllegalArgumentException if the hint names no kind
     */
    public static SourceKind fromHint(String hint) {
        Preconditions.checkArgument(hint != null && !hint.isBlank(), "Source hint cannot be blank");
        String normalized = hint.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.sourceId.equalsIgnoreCase(normalized)
                        || kind.name().equals(normalized.toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown source hint: " + hint));
    }
}
