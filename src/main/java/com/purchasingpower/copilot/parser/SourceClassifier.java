package com.purchasingpower.copilot.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides which format family a raw context blob belongs to.
 *
 * <p>Rules are case-insensitive substring tests evaluated in a fixed order, first match wins:
 * <ol>
 *   <li>{@code <result>} or "tavily" - {@link SourceKind#SEARCH}</li>
 *   <li>"categories:" or "arxiv" - {@link SourceKind#ACADEMIC_PAPER}</li>
 *   <li>"ticker:" or "yfinance" - {@link SourceKind#MARKET_DATA}</li>
 *   <li>"query:" or "rag" - {@link SourceKind#KNOWLEDGE_INTERACTION}</li>
 * </ol>
 * A blob matching several rules resolves to the earliest one. A blob matching none is
 * {@link SourceKind#UNKNOWN}, which is not an error.
 */
@Slf4j
@Component
public class SourceClassifier {

    public SourceKind classify(String text) {
        if (text == null || text.isBlank()) {
            return SourceKind.UNKNOWN;
        }

        String lower = text.toLowerCase(Locale.ROOT);
        SourceKind kind;

        if (lower.contains("<result>") || lower.contains("tavily")) {
            kind = SourceKind.SEARCH;
        } else if (lower.contains("categories:") || lower.contains("arxiv")) {
            kind = SourceKind.ACADEMIC_PAPER;
        } else if (lower.contains("ticker:") || lower.contains("yfinance")) {
            kind = SourceKind.MARKET_DATA;
        } else if (lower.contains("query:") || lower.contains("rag")) {
            kind = SourceKind.KNOWLEDGE_INTERACTION;
        } else {
            kind = SourceKind.UNKNOWN;
        }

        log.debug("Classified context ({} chars) as {}", text.length(), kind);
        return kind;
    }
}
