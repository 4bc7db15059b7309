package com.purchasingpower.copilot.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.purchasingpower.copilot.exception.ContextParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a context blob into records using the rules of its {@link SourceFormat}.
 *
 * <p>Each block is matched field by field; a block where no field matches produces no record.
 * Blobs of unknown origin are not split into blocks. Instead a fixed set of token classes is
 * scanned over the whole text, see {@link #extractGeneric(String)}.
 */
@Slf4j
@Component
public class PatternExtractor {

    private static final Map<String, Pattern> GENERIC_PATTERNS = ImmutableMap.of(
            "urls", Pattern.compile("https?://[^\\s<>\"]+"),
            "emails", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b"),
            "dates", Pattern.compile("\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}"),
            "numbers", Pattern.compile("\\$?\\d[\\d,]*\\.?\\d*"),
            "percentages", Pattern.compile("\\d[\\d,]*\\.?\\d*%"));

    /**
     * Extract records for a recognised kind.
     *
     * @return one record per block that matched at least one field; empty for UNKNOWN
     * @throws ContextParseException if matching fails for a field
     */
    public List<ParsedRecord> extract(SourceKind kind, String text) {
        Preconditions.checkNotNull(kind, "Source kind cannot be null");
        Preconditions.checkNotNull(text, "Context text cannot be null");

        SourceFormat format = SourceFormat.forKind(kind).orElse(null);
        if (format == null) {
            return ImmutableList.of();
        }

        List<String> blocks = format.splitBlocks(text);
        ImmutableList.Builder<ParsedRecord> records = ImmutableList.builder();
        int dropped = 0;

        for (String block : blocks) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (ExtractionRule rule : format.getRules()) {
                try {
                    rule.extract(block).ifPresent(value -> fields.put(rule.getField(), value));
                } catch (RuntimeException e) {
                    throw new ContextParseException(kind, rule.getField(),
                            "Failed to extract '" + rule.getField() + "' from " + kind.getSourceId() + " block", e);
                }
            }
            if (fields.isEmpty()) {
                dropped++;
            } else {
                records.add(ParsedRecord.of(fields));
            }
        }

        List<ParsedRecord> result = records.build();
        log.debug("Extracted {} {} records from {} blocks ({} without fields)",
                result.size(), kind, blocks.size(), dropped);
        return result;
    }

    /**
     * Scan a blob of unknown origin for URLs, emails, dates, numbers and percentages.
     *
     * @return token class to matches in order of appearance; classes without matches are omitted
     */
    public Map<String, List<String>> extractGeneric(String text) {
        Preconditions.checkNotNull(text, "Context text cannot be null");

        Map<String, List<String>> extracted = new LinkedHashMap<>();
        for (Map.Entry<String, Pattern> entry : GENERIC_PATTERNS.entrySet()) {
            List<String> matches = new ArrayList<>();
            try {
                Matcher matcher = entry.getValue().matcher(text);
                while (matcher.find()) {
                    matches.add(matcher.group());
                }
            } catch (RuntimeException e) {
                throw new ContextParseException(SourceKind.UNKNOWN, entry.getKey(),
                        "Failed to scan for " + entry.getKey(), e);
            }
            if (!matches.isEmpty()) {
                extracted.put(entry.getKey(), ImmutableList.copyOf(matches));
            }
        }

        log.debug("Generic scan found token classes {}", extracted.keySet());
        return ImmutableMap.copyOf(extracted);
    }
}
