package com.purchasingpower.copilot.parser;

import com.google.common.base.Strings;
import com.purchasingpower.copilot.util.TextPreview;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link ParsedContext} as the human-readable display text.
 *
 * <p>Labels, their order and the truncation lengths (200 chars of search content, 300 chars of
 * paper abstracts and knowledge base responses, 500 chars of raw unknown content) are consumed
 * downstream and must stay stable. Missing fields render as {@code N/A}.
 *
 * <p>Every record starts with its kind's block marker and 1-based index, which lets the
 * rendered text be parsed again into the same number of records.
 */
@Component
public class ContextFormatter {

    static final String MISSING = "N/A";
    static final int SEARCH_CONTENT_LENGTH = 200;
    static final int ABSTRACT_LENGTH = 300;
    static final int RESPONSE_LENGTH = 300;
    static final int RAW_CONTENT_LENGTH = 500;
    static final int EXTRACTED_SAMPLE_SIZE = 5;

    private static final String RULE = Strings.repeat("=", 50);

    public String format(ParsedContext context) {
        return switch (context.getSourceKind()) {
            case SEARCH -> formatSearch(context);
            case ACADEMIC_PAPER -> formatPapers(context);
            case MARKET_DATA -> formatStocks(context);
            case KNOWLEDGE_INTERACTION -> formatInteractions(context);
            case UNKNOWN -> formatGeneric(context);
        };
    }

    private String formatSearch(ParsedContext context) {
        StringBuilder out = header("Tavily Search Results (" + context.getRecordCount() + " results)");
        int index = 1;
        for (ParsedRecord record : context.getRecords()) {
            out.append(SourceFormat.SEARCH.getBlockMarker()).append(' ').append(index++).append('\n');
            line(out, "Title", value(record, "title"));
            line(out, "URL", value(record, "url"));
            line(out, "Score", value(record, "score"));
            line(out, "Content", TextPreview.head(value(record, "content"), SEARCH_CONTENT_LENGTH) + "...");
            out.append('\n');
        }
        return out.toString();
    }

    private String formatPapers(ParsedContext context) {
        StringBuilder out = header("ArXiv Papers (" + context.getRecordCount() + " papers)");
        int index = 1;
        for (ParsedRecord record : context.getRecords()) {
            out.append(SourceFormat.ACADEMIC_PAPER.getBlockMarker()).append(' ').append(index++).append('\n');
            line(out, "Title", value(record, "title"));
            line(out, "Authors", value(record, "authors"));
            line(out, "Categories", value(record, "categories"));
            line(out, "DOI", value(record, "doi"));
            line(out, "Date", value(record, "date"));
            line(out, "Abstract", TextPreview.head(value(record, "abstract"), ABSTRACT_LENGTH) + "...");
            out.append('\n');
        }
        return out.toString();
    }

    private String formatStocks(ParsedContext context) {
        StringBuilder out = header("YFinance Data (" + context.getRecordCount() + " stocks)");
        int index = 1;
        for (ParsedRecord record : context.getRecords()) {
            out.append(SourceFormat.MARKET_DATA.getBlockMarker()).append(' ').append(index++).append('\n');
            line(out, "Ticker", value(record, "ticker"));
            line(out, "Price", "$" + value(record, "price"));
            line(out, "Change", value(record, "change"));
            line(out, "Volume", value(record, "volume"));
            line(out, "Market Cap", "$" + value(record, "market_cap"));
            line(out, "P/E Ratio", value(record, "pe_ratio"));
            line(out, "Dividend Yield", value(record, "dividend_yield"));
            out.append('\n');
        }
        return out.toString();
    }

    private String formatInteractions(ParsedContext context) {
        StringBuilder out = header("AI RAG Interactions (" + context.getRecordCount() + " interactions)");
        int index = 1;
        for (ParsedRecord record : context.getRecords()) {
            out.append(SourceFormat.KNOWLEDGE_INTERACTION.getBlockMarker()).append(' ').append(index++).append('\n');
            line(out, "Query", value(record, "query"));
            line(out, "Response", TextPreview.head(value(record, "response"), RESPONSE_LENGTH) + "...");
            line(out, "Sources", value(record, "sources"));
            line(out, "Confidence", value(record, "confidence"));
            line(out, "Timestamp", value(record, "timestamp"));
            out.append('\n');
        }
        return out.toString();
    }

    private String formatGeneric(ParsedContext context) {
        StringBuilder out = header("Generic Context Data");
        line(out, "Source", context.getSourceKind().getSourceId());
        line(out, "Raw Content", TextPreview.head(Strings.nullToEmpty(context.getRawContent()), RAW_CONTENT_LENGTH) + "...");
        out.append('\n');

        Map<String, List<String>> extracted = context.getExtractedData();
        if (extracted != null) {
            out.append("Extracted Data:\n");
            extracted.forEach((tokenClass, matches) -> line(out, titleCase(tokenClass),
                    matches.subList(0, Math.min(EXTRACTED_SAMPLE_SIZE, matches.size())).toString()));
        }
        return out.toString();
    }

    private static StringBuilder header(String title) {
        return new StringBuilder(title).append('\n').append(RULE).append("\n\n");
    }

    private static void line(StringBuilder out, String label, String value) {
        out.append(label).append(": ").append(value).append('\n');
    }

    private static String value(ParsedRecord record, String field) {
        return record.get(field).orElse(MISSING);
    }

    private static String titleCase(String key) {
        return key.substring(0, 1).toUpperCase(Locale.ROOT) + key.substring(1);
    }
}
