package com.purchasingpower.copilot.parser;

import com.purchasingpower.copilot.exception.ContextParseException;
import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One field of a source format: the field name and the compiled pattern that captures it.
 *
 * <p>The pattern is applied unanchored and only its first match counts. The value is the first
 * capture group that participated in that match, trimmed, so a pattern may offer alternatives
 * (e.g. the tagged {@code <title>...</title>} form and the labelled {@code Title: ...} form).
 */
@Value
public class ExtractionRule {

    String field;
    Pattern pattern;

    /**
     * Compile a rule.
     *
     * @throws ContextParseException if the regex does not compile
     */
    public static ExtractionRule of(SourceKind kind, String field, String regex, int flags) {
        try {
            return new ExtractionRule(field, Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            throw new ContextParseException(kind, field,
                    "Invalid pattern for field '" + field + "': " + e.getDescription(), e);
        }
    }

    /**
     * Apply the rule to one block.
     *
     * @return trimmed capture, or empty if the pattern does not match
     */
    public Optional<String> extract(String block) {
        Matcher matcher = pattern.matcher(block);
        if (!matcher.find()) {
            return Optional.empty();
        }
        if (matcher.groupCount() == 0) {
            return Optional.of(matcher.group().trim());
        }
        for (int group = 1; group <= matcher.groupCount(); group++) {
            String value = matcher.group(group);
            if (value != null) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }
}
