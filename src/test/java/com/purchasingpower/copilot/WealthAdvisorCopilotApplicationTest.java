package com.purchasingpower.copilot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.copilot.agent.FakeTool;
import com.purchasingpower.copilot.agent.Tool;
import com.purchasingpower.copilot.agent.Tool.ToolCategory;
import com.purchasingpower.copilot.agent.ToolOrchestrator;
import com.purchasingpower.copilot.agent.ToolResult;
import com.purchasingpower.copilot.configuration.AdvisorProperties;
import com.purchasingpower.copilot.model.dto.ContextParseResponse;
import com.purchasingpower.copilot.model.dto.OrchestrationResult;
import com.purchasingpower.copilot.parser.ContextParser;
import com.purchasingpower.copilot.service.UsageStatsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring test for the application context.
 *
 * Source tools are replaced by fakes; everything else is the production configuration
 * bound from application-test.yml.
 */
@SpringBootTest
@ActiveProfiles("test")
class WealthAdvisorCopilotApplicationTest {

    @TestConfiguration
    static class FakeSources {

        @Bean
        Tool webSearchTool() {
            return FakeTool.returning(ToolCategory.WEB_SEARCH, "Rates were held steady this quarter.");
        }

        @Bean
        Tool knowledgeBaseTool() {
            return FakeTool.returning(ToolCategory.KNOWLEDGE_BASE, ToolResult.builder()
                    .text("Keep six months of expenses in cash.")
                    .contextPassage("Emergency funds cover three to six months of expenses.")
                    .source("planning-guide.pdf")
                    .retrievalScore(0.66)
                    .informative(true)
                    .build());
        }
    }

    @Autowired
    private ToolOrchestrator orchestrator;

    @Autowired
    private ContextParser contextParser;

    @Autowired
    private UsageStatsRecorder usageStats;

    @Autowired
    private AdvisorProperties properties;

    @Autowired
    @Qualifier("toolExecutor")
    private ThreadPoolTaskExecutor toolExecutor;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        usageStats.reset();
    }

    @Test
    void contextLoads_shouldBindExecutorProperties() {
        // Then
        assertThat(properties.getDefaultConfidence()).isEqualTo(0.85);
        assertThat(toolExecutor.getCorePoolSize()).isEqualTo(2);
        assertThat(toolExecutor.getMaxPoolSize()).isEqualTo(4);
        assertThat(toolExecutor.getThreadNamePrefix()).isEqualTo("advisor-tool-test-");
    }

    @Test
    void process_shouldUseRegisteredTools() throws Exception {
        // When
        OrchestrationResult result = orchestrator.process("How large should my emergency savings be?");

        // Then
        assertThat(result.getToolsAttempted()).containsExactly("tavily_search", "rag_query");
        assertThat(result.getConfidence()).isEqualTo(0.66);
        assertThat(result.getContextSnippets()).containsExactly(
                "Search results from Tavily",
                "Emergency funds cover three to six months of expenses.");
        assertThat(usageStats.snapshot().getTotalQueries()).isEqualTo(1);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));
        assertThat(json.has("tools_used")).isTrue();
        assertThat(json.has("processing_time")).isTrue();
        assertThat(json.get("response").asText()).startsWith("Based on my analysis using multiple sources:");
        assertThat(json.get("category").asText()).isEqualTo("general_advice");
        assertThat(json.has("toolResults")).isFalse();
    }

    @Test
    void toolStatus_shouldReportMissingSources() {
        // Then
        assertThat(orchestrator.getToolStatus())
                .containsEntry("tavily_search", true)
                .containsEntry("arxiv_search", false)
                .containsEntry("total_tools", 2);
    }

    @Test
    void describe_shouldSerializeWithWireNames() throws Exception {
        // When
        ContextParseResponse response = contextParser.describe("Stock: AAPL\nTicker: AAPL\nPrice: $189.50", null);
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(response));

        // Then
        assertThat(json.get("source").asText()).isEqualTo("yfinance");
        assertThat(json.get("parsed_data").get("total_stocks").asInt()).isEqualTo(1);
        assertThat(json.get("parsed_data").get("stocks").get(0).get("price").asText()).isEqualTo("189.50");
        assertThat(json.get("parsed_data").has("records")).isFalse();
        assertThat(json.get("parsed_data").has("raw_content")).isFalse();
        assertThat(json.get("formatted_output").asText()).startsWith("YFinance Data (1 stocks)");
    }

    @Test
    void describe_unknownContext_shouldCarryRawContentWithoutRecordKeys() throws Exception {
        // When
        ContextParseResponse response = contextParser.describe("Visit https://example.com on 2024-01-15", null);
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(response));

        // Then
        JsonNode parsed = json.get("parsed_data");
        assertThat(json.get("source").asText()).isEqualTo("unknown");
        assertThat(parsed.has("raw_content")).isTrue();
        assertThat(parsed.get("extracted_data").get("urls").get(0).asText()).isEqualTo("https://example.com");
        assertThat(parsed.has("records")).isFalse();
        assertThat(parsed.has("total_records")).isFalse();
    }
}
