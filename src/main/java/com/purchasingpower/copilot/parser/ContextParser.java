package com.purchasingpower.copilot.parser;

import com.google.common.base.Preconditions;
import com.purchasingpower.copilot.model.dto.ContextParseResponse;
import com.purchasingpower.copilot.util.TextPreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the context parsing subsystem.
 *
 * <p>Classifies a blob (unless the caller already knows its source), extracts its records and
 * renders them for display. Independent of query orchestration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextParser {

    private final SourceClassifier classifier;
    private final PatternExtractor extractor;
    private final ContextFormatter formatter;

    public ParsedContext parse(String text) {
        return parse(text, null);
    }

    /**
     * Parse a blob as the given kind.
     *
     * @param kind source kind, or {@code null} to classify the text first
     * @throws com.purchasingpower.copilot.exception.ContextParseException if extraction fails
     */
    public ParsedContext parse(String text, SourceKind kind) {
        Preconditions.checkNotNull(text, "Context text cannot be null");

        SourceKind resolved = kind != null ? kind : classifier.classify(text);
        log.debug("Parsing {} context: {}", resolved, TextPreview.preview(text, 120));

        if (resolved == SourceKind.UNKNOWN) {
            Map<String, List<String>> extracted = extractor.extractGeneric(text);
            return ParsedContext.builder()
                    .sourceKind(SourceKind.UNKNOWN)
                    .rawContent(text)
                    .extractedData(extracted)
                    .build();
        }

        ParsedContext context = ParsedContext.builder()
                .sourceKind(resolved)
                .records(extractor.extract(resolved, text))
                .build();
        log.info("Parsed {} context into {} records", resolved.getSourceId(), context.getRecordCount());
        return context;
    }

    public String format(ParsedContext context) {
        Preconditions.checkNotNull(context, "Parsed context cannot be null");
        return formatter.format(context);
    }

    /**
     * Parse and render in one call.
     *
     * @param sourceHint source id or kind name, or {@code null} to classify
     * @throws IllegalArgumentException if the hint names no known source
     */
    public ContextParseResponse describe(String text, String sourceHint) {
        SourceKind kind = sourceHint == null ? null : SourceKind.fromHint(sourceHint);
        ParsedContext context = parse(text, kind);
        return ContextParseResponse.builder()
                .source(context.getSourceKind())
                .parsedData(context)
                .formattedOutput(format(context))
                .build();
    }
}
