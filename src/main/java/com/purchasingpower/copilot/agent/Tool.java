package com.purchasingpower.copilot.agent;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/**
 * An independent information source the orchestrator can consult.
 *
 * <p>Implementations wrap one external collaborator (web search, paper search, market data,
 * knowledge base) and are registered as Spring beans. They may throw; the orchestrator isolates
 * every failure so one broken source never aborts a query.
 *
 * <p>Example implementation:
 * <pre>
 * &#64;Component
 * public class TavilySearchTool implements Tool {
 *     public ToolCategory getCategory() { return ToolCategory.WEB_SEARCH; }
 *
 *     public String getDescription() { return "Search the web for current information"; }
 *
 *     public ToolResult execute(String input) throws Exception {
 *         return ToolResult.of(client.search(input));
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface Tool {

    /**
     * Which source slot this tool fills. At most one tool per category is used.
     */
    ToolCategory getCategory();

    /**
     * Identifier reported in {@code tools_used} and usage stats.
     */
    default String getName() {
        return getCategory().getToolId();
    }

    /**
     * Human-readable description of the source.
     */
    String getDescription();

    /**
     * Consult the source.
     *
     * @param input the question, or the symbol for {@link ToolCategory#MARKET_DATA}
     * @return source output
     * @throws Exception any collaborator failure
     */
    ToolResult execute(String input) throws Exception;

    /**
     * Source slots, in the order the orchestrator consults them.
     */
    enum ToolCategory {

        WEB_SEARCH("tavily_search", "Current Information:", "Search results from Tavily",
                ImmutableList.of("Error"), ImmutableList.of()),

        ACADEMIC_SEARCH("arxiv_search", "Academic Research:", "Academic papers from ArXiv",
                ImmutableList.of("No papers found", "Error"), ImmutableList.of()),

        /**
         * Label and provenance carry the symbol via {@code %s}.
         */
        MARKET_DATA("yfinance_data", "Stock Data for %s:", "Stock market data for %s",
                ImmutableList.of("Error"), ImmutableList.of("not found")),

        /**
         * Normally judges its own informativeness through {@link ToolResult#getInformative()};
         * the marker only applies when it leaves the verdict unset.
         */
        KNOWLEDGE_BASE("rag_query", "Knowledge Base (PDFs):", null,
                ImmutableList.of(), ImmutableList.of("don't have specific information"));

        private final String toolId;
        private final String labelTemplate;
        private final String provenanceTemplate;
        private final List<String> failureMarkers;
        private final List<String> caseInsensitiveMarkers;

        ToolCategory(String toolId, String labelTemplate, String provenanceTemplate,
                     List<String> failureMarkers, List<String> caseInsensitiveMarkers) {
            this.toolId = toolId;
            this.labelTemplate = labelTemplate;
            this.provenanceTemplate = provenanceTemplate;
            this.failureMarkers = failureMarkers;
            this.caseInsensitiveMarkers = caseInsensitiveMarkers;
        }

        public String getToolId() {
            return toolId;
        }

        /**
         * Prefix of this source's fragment in the fused answer.
         */
        public String label(String input) {
            return String.format(Locale.ROOT, labelTemplate, input);
        }

        /**
         * Context snippet naming where a fragment came from, or {@code null} for the knowledge
         * base, which contributes its own passages instead.
         */
        public String provenance(String input) {
            return provenanceTemplate == null ? null : String.format(Locale.ROOT, provenanceTemplate, input);
        }

        /**
         * Whether plain-text output from this source signals that nothing useful was found.
         */
        public boolean indicatesFailure(String text) {
            if (failureMarkers.stream().anyMatch(text::contains)) {
                return true;
            }
            String lower = text.toLowerCase(Locale.ROOT);
            return caseInsensitiveMarkers.stream().anyMatch(lower::contains);
        }
    }
}
