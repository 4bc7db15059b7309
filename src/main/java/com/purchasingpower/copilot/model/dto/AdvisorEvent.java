package com.purchasingpower.copilot.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress event of a streamed query.
 *
 * Event types:
 * - THINKING: Query accepted and categorized
 * - TOOL: A source tool started or finished
 * - COMPLETE: Final fused response
 * - ERROR: Query failed
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdvisorEvent {

    @JsonProperty("chunk_id")
    private String chunkId;

    private EventType type;
    private String tool;
    private String message;
    private String content;

    @JsonProperty("is_final")
    private boolean finalChunk;

    public enum EventType {
        THINKING,
        TOOL,
        COMPLETE,
        ERROR
    }

    public static AdvisorEvent thinking(String message) {
        return AdvisorEvent.builder()
            .type(EventType.THINKING)
            .message(message)
            .build();
    }

    public static AdvisorEvent tool(String toolName, String status) {
        return AdvisorEvent.builder()
            .type(EventType.TOOL)
            .tool(toolName)
            .message(status)
            .build();
    }

    public static AdvisorEvent complete(String response) {
        return AdvisorEvent.builder()
            .type(EventType.COMPLETE)
            .content(response)
            .finalChunk(true)
            .build();
    }

    public static AdvisorEvent error(String error) {
        return AdvisorEvent.builder()
            .type(EventType.ERROR)
            .message(error)
            .finalChunk(true)
            .build();
    }
}
