package com.purchasingpower.copilot.parser;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of parsing one context blob.
 *
 * <p>For recognised kinds {@code records} holds one entry per non-empty block. For
 * {@link SourceKind#UNKNOWN} it is empty and the blob is kept as {@code rawContent} together
 * with the generic token matches in {@code extractedData}.
 *
 * <p>In JSON the records are keyed per kind, e.g. {@code papers} and {@code total_papers}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedContext {

    @JsonProperty("source")
    SourceKind sourceKind;

    @JsonIgnore
    @Singular
    List<ParsedRecord> records;

    @JsonProperty("raw_content")
    String rawContent;

    @JsonProperty("extracted_data")
    Map<String, List<String>> extractedData;

    @JsonIgnore
    public int getRecordCount() {
        return records.size();
    }

    @JsonAnyGetter
    public Map<String, Object> recordsByKind() {
        String key = sourceKind == null ? null : sourceKind.getRecordsKey();
        if (key == null) {
            return Map.of();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, records);
        payload.put("total_" + key, records.size());
        return payload;
    }
}
