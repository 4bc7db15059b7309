package com.purchasingpower.copilot.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.copilot.parser.ParsedContext;
import com.purchasingpower.copilot.parser.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parsed context bundled with its display rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextParseResponse {

    private SourceKind source;

    @JsonProperty("parsed_data")
    private ParsedContext parsedData;

    @JsonProperty("formatted_output")
    private String formattedOutput;
}
