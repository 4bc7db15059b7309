package com.purchasingpower.copilot.parser;

import com.google.common.collect.ImmutableList;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Block layout and field rules of one source kind.
 *
 * <p>A blob is cut into blocks on {@link #getDelimiter()}. For kinds whose blocks are introduced
 * by a marker, the text before the first marker is not a block. Each block is then run through
 * every {@link ExtractionRule} independently.
 *
 * <p>{@link #getBlockMarker()} is what the display template writes at the head of every
 * rendered record, so rendered output splits back into the same number of blocks.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SourceFormat {

    SourceKind kind;
    Pattern delimiter;
    boolean leadingSegmentIsBlock;
    String blockMarker;
    List<ExtractionRule> rules;

    private static final int TAGGED = Pattern.DOTALL | Pattern.MULTILINE;
    private static final int PROSE = Pattern.DOTALL | Pattern.CASE_INSENSITIVE;

    public static final SourceFormat SEARCH = new SourceFormat(
            SourceKind.SEARCH,
            Pattern.compile(Pattern.quote("<result>")),
            false,
            "<result>",
            ImmutableList.of(
                    tagOrLabel("title", "Title"),
                    tagOrLabel("content", "Content"),
                    tagOrLabel("url", "URL"),
                    tagOrLabel("score", "Score")));

    public static final SourceFormat ACADEMIC_PAPER = new SourceFormat(
            SourceKind.ACADEMIC_PAPER,
            Pattern.compile("\\n\\n+"),
            true,
            "Paper:",
            ImmutableList.of(
                    rule(SourceKind.ACADEMIC_PAPER, "title", "Title:\\s*(.*?)(?:\\n|$)", PROSE),
                    rule(SourceKind.ACADEMIC_PAPER, "authors", "Authors:\\s*(.*?)(?:\\n|$)", PROSE),
                    rule(SourceKind.ACADEMIC_PAPER, "abstract", "Abstract:\\s*(.*?)(?:\\n\\n|\\n[A-Z]|$)", PROSE),
                    rule(SourceKind.ACADEMIC_PAPER, "categories", "Categories:\\s*(.*?)(?:\\n|$)", PROSE),
                    rule(SourceKind.ACADEMIC_PAPER, "doi", "DOI:\\s*(.*?)(?:\\n|$)", PROSE),
                    rule(SourceKind.ACADEMIC_PAPER, "arxiv_id", "arXiv:(\\d+\\.\\d+)", PROSE),
                    rule(SourceKind.ACADEMIC_PAPER, "date", "Date:\\s*(.*?)(?:\\n|$)", PROSE)));

    public static final SourceFormat MARKET_DATA = new SourceFormat(
            SourceKind.MARKET_DATA,
            Pattern.compile("Stock:\\s*"),
            false,
            "Stock:",
            ImmutableList.of(
                    rule(SourceKind.MARKET_DATA, "ticker", "Ticker:\\s*([A-Z]+)", Pattern.CASE_INSENSITIVE),
                    rule(SourceKind.MARKET_DATA, "price", "Price:\\s*\\$?([\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE),
                    rule(SourceKind.MARKET_DATA, "change", "Change:\\s*([+-]?\\$?[\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE),
                    rule(SourceKind.MARKET_DATA, "volume", "Volume:\\s*([\\d,]+)", Pattern.CASE_INSENSITIVE),
                    rule(SourceKind.MARKET_DATA, "market_cap", "Market Cap:\\s*\\$?([\\d,]+\\.?\\d*[KMB]?)", Pattern.CASE_INSENSITIVE),
                    rule(SourceKind.MARKET_DATA, "pe_ratio", "P/E Ratio:\\s*([\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE),
                    rule(SourceKind.MARKET_DATA, "dividend_yield", "Dividend Yield:\\s*([\\d,]+\\.?\\d*%)", Pattern.CASE_INSENSITIVE)));

    public static final SourceFormat KNOWLEDGE_INTERACTION = new SourceFormat(
            SourceKind.KNOWLEDGE_INTERACTION,
            Pattern.compile("Interaction:\\s*"),
            false,
            "Interaction:",
            ImmutableList.of(
                    rule(SourceKind.KNOWLEDGE_INTERACTION, "query", "Query:\\s*(.*?)(?:\\n|$)", PROSE),
                    rule(SourceKind.KNOWLEDGE_INTERACTION, "response", "Response:\\s*(.*?)(?:\\n\\n|\\n[A-Z]|$)", PROSE),
                    rule(SourceKind.KNOWLEDGE_INTERACTION, "sources", "Sources:\\s*(.*?)(?:\\n\\n|\\n[A-Z]|$)", PROSE),
                    rule(SourceKind.KNOWLEDGE_INTERACTION, "confidence", "Confidence:\\s*([\\d,]+\\.?\\d*%)", PROSE),
                    rule(SourceKind.KNOWLEDGE_INTERACTION, "timestamp", "Timestamp:\\s*(.*?)(?:\\n|$)", PROSE)));

    /**
     * Format for a kind, or empty for {@link SourceKind#UNKNOWN}, which has no block layout.
     */
    public static Optional<SourceFormat> forKind(SourceKind kind) {
        return switch (kind) {
            case SEARCH -> Optional.of(SEARCH);
            case ACADEMIC_PAPER -> Optional.of(ACADEMIC_PAPER);
            case MARKET_DATA -> Optional.of(MARKET_DATA);
            case KNOWLEDGE_INTERACTION -> Optional.of(KNOWLEDGE_INTERACTION);
            case UNKNOWN -> Optional.empty();
        };
    }

    /**
     * Cut a blob into candidate blocks. Blank blocks are kept; they simply yield no fields.
     */
    public List<String> splitBlocks(String text) {
        String source = leadingSegmentIsBlock ? text.strip() : text;
        String[] segments = delimiter.split(source, -1);
        int first = leadingSegmentIsBlock ? 0 : 1;
        if (segments.length <= first) {
            return List.of();
        }
        return List.of(segments).subList(first, segments.length);
    }

    private static ExtractionRule rule(SourceKind kind, String field, String regex, int flags) {
        return ExtractionRule.of(kind, field, regex, flags);
    }

    // Raw Tavily output carries <field>..</field> tags, rendered output carries "Label: value" lines
    private static ExtractionRule tagOrLabel(String field, String label) {
        String regex = "<" + field + ">(.*?)</" + field + ">|^" + Pattern.quote(label) + ":[ \\t]*(.*?)$";
        return ExtractionRule.of(SourceKind.SEARCH, field, regex, TAGGED);
    }
}
