package com.purchasingpower.copilot.parser;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Fields extracted from one block, in rule order. Fields whose pattern did not match are absent.
 */
@Value
public class ParsedRecord {

    @JsonValue
    ImmutableMap<String, String> fields;

    public static ParsedRecord of(Map<String, String> fields) {
        return new ParsedRecord(ImmutableMap.copyOf(fields));
    }

    public Optional<String> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }
}
