package com.purchasingpower.copilot.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Pattern Extractor Tests")
class PatternExtractorTest {

    static final String SEARCH_TEXT = "Search results for bond ladders\n"
            + "<result>\n"
            + "<title>Building a Bond Ladder</title>\n"
            + "<url>https://a.example/ladder</url>\n"
            + "<content>Stagger maturities to manage rate risk.</content>\n"
            + "<score>0.91</score>\n"
            + "</result>\n"
            + "<result>\n"
            + "<title>Treasury Basics</title>\n"
            + "<url>https://b.example/treasury</url>\n"
            + "</result>\n";

    static final String PAPER_TEXT = "Title: Portfolio Optimization\n"
            + "Authors: A. Smith, B. Jones\n"
            + "Abstract: We study mean-variance allocation.\n"
            + "Categories: q-fin.PM\n"
            + "DOI: 10.1000/xyz\n"
            + "arXiv:2101.00001\n"
            + "Date: 2021-01-01\n"
            + "\n"
            + "Title: Second Paper\n"
            + "Authors: C. Lee";

    static final String MARKET_TEXT = "Market snapshot\n"
            + "Stock: AAPL\n"
            + "Ticker: AAPL\n"
            + "Price: $189.50\n"
            + "Change: +1.25\n"
            + "Volume: 52,000,000\n"
            + "Market Cap: $950.3B\n"
            + "P/E Ratio: 29.4\n"
            + "Dividend Yield: 0.5%\n"
            + "\n"
            + "Stock: MSFT\n"
            + "Ticker: MSFT\n"
            + "Price: 410.10\n";

    static final String INTERACTION_TEXT = "Interaction: 1\n"
            + "Query: How should I rebalance?\n"
            + "Response: Rebalance annually.\n"
            + "Sources: guide.pdf\n"
            + "Confidence: 87.5%\n"
            + "Timestamp: 2024-05-01T10:00:00\n"
            + "\n"
            + "Interaction: 2\n"
            + "Query: What is an ETF?\n";

    private final PatternExtractor extractor = new PatternExtractor();

    @Test
    @DisplayName("Should extract tagged search results and omit missing fields")
    void testExtract_Search_ShouldReadTags() {
        List<ParsedRecord> records = extractor.extract(SourceKind.SEARCH, SEARCH_TEXT);

        assertEquals(2, records.size());
        assertThat(records.get(0).getFields()).containsExactly(
                Map.entry("title", "Building a Bond Ladder"),
                Map.entry("content", "Stagger maturities to manage rate risk."),
                Map.entry("url", "https://a.example/ladder"),
                Map.entry("score", "0.91"));
        assertThat(records.get(1).getFields()).containsOnlyKeys("title", "url");
        assertTrue(records.get(1).get("score").isEmpty());
    }

    @Test
    @DisplayName("Should drop blocks without any field")
    void testExtract_EmptyBlock_ShouldBeDropped() {
        List<ParsedRecord> records = extractor.extract(SourceKind.SEARCH,
                "<result>nothing to see<result><title>Only one</title>");

        assertEquals(1, records.size());
        assertEquals("Only one", records.get(0).get("title").orElseThrow());
    }

    @Test
    @DisplayName("Should split papers on blank lines")
    void testExtract_Papers_ShouldReadEveryParagraph() {
        List<ParsedRecord> records = extractor.extract(SourceKind.ACADEMIC_PAPER, PAPER_TEXT);

        assertEquals(2, records.size());
        ParsedRecord first = records.get(0);
        assertEquals("Portfolio Optimization", first.get("title").orElseThrow());
        assertEquals("A. Smith, B. Jones", first.get("authors").orElseThrow());
        assertEquals("We study mean-variance allocation.", first.get("abstract").orElseThrow());
        assertEquals("q-fin.PM", first.get("categories").orElseThrow());
        assertEquals("10.1000/xyz", first.get("doi").orElseThrow());
        assertEquals("2101.00001", first.get("arxiv_id").orElseThrow());
        assertEquals("2021-01-01", first.get("date").orElseThrow());
        assertThat(records.get(1).getFields()).containsOnlyKeys("title", "authors");
    }

    @Test
    @DisplayName("Should extract market quotes per Stock block")
    void testExtract_Market_ShouldReadQuotes() {
        List<ParsedRecord> records = extractor.extract(SourceKind.MARKET_DATA, MARKET_TEXT);

        assertEquals(2, records.size());
        ParsedRecord apple = records.get(0);
        assertEquals("AAPL", apple.get("ticker").orElseThrow());
        assertEquals("189.50", apple.get("price").orElseThrow());
        assertEquals("+1.25", apple.get("change").orElseThrow());
        assertEquals("52,000,000", apple.get("volume").orElseThrow());
        assertEquals("950.3B", apple.get("market_cap").orElseThrow());
        assertEquals("29.4", apple.get("pe_ratio").orElseThrow());
        assertEquals("0.5%", apple.get("dividend_yield").orElseThrow());
        assertThat(records.get(1).getFields()).containsOnlyKeys("ticker", "price");
    }

    @Test
    @DisplayName("Should extract knowledge base interactions")
    void testExtract_Interactions_ShouldReadEachExchange() {
        List<ParsedRecord> records = extractor.extract(SourceKind.KNOWLEDGE_INTERACTION, INTERACTION_TEXT);

        assertEquals(2, records.size());
        ParsedRecord first = records.get(0);
        assertEquals("How should I rebalance?", first.get("query").orElseThrow());
        assertEquals("Rebalance annually.", first.get("response").orElseThrow());
        assertEquals("guide.pdf", first.get("sources").orElseThrow());
        assertEquals("87.5%", first.get("confidence").orElseThrow());
        assertEquals("2024-05-01T10:00:00", first.get("timestamp").orElseThrow());
        assertEquals("What is an ETF?", records.get(1).get("query").orElseThrow());
    }

    @Test
    @DisplayName("Should return no records for unknown sources")
    void testExtract_Unknown_ShouldBeEmpty() {
        assertTrue(extractor.extract(SourceKind.UNKNOWN, "anything").isEmpty());
    }

    @Test
    @DisplayName("Should scan token classes in fixed order")
    void testExtractGeneric_ShouldScanTokenClasses() {
        Map<String, List<String>> data = extractor.extractGeneric(
                "Visit https://example.com/report or mail ops@example.com by 12/31/2024. Growth was 4.5% this year.");

        assertThat(data).containsOnlyKeys("urls", "emails", "dates", "numbers", "percentages");
        assertThat(data.keySet()).containsExactly("urls", "emails", "dates", "numbers", "percentages");
        assertThat(data.get("urls")).containsExactly("https://example.com/report");
        assertThat(data.get("emails")).containsExactly("ops@example.com");
        assertThat(data.get("dates")).containsExactly("12/31/2024");
        assertThat(data.get("percentages")).containsExactly("4.5%");
        assertThat(data.get("numbers")).startsWith("12", "31");
    }

    @Test
    @DisplayName("Should omit token classes without matches")
    void testExtractGeneric_NoTokens_ShouldBeEmpty() {
        assertTrue(extractor.extractGeneric("plain words only").isEmpty());
    }

    @Test
    @DisplayName("Should reject null text")
    void testExtract_NullText_ShouldThrow() {
        assertThrows(NullPointerException.class, () -> extractor.extract(SourceKind.SEARCH, null));
        assertThrows(NullPointerException.class, () -> extractor.extractGeneric(null));
    }
}
