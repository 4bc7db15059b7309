package com.purchasingpower.copilot.exception;

import com.purchasingpower.copilot.parser.SourceKind;
import lombok.Getter;

/**
 * Raised when a context blob cannot be extracted, e.g. a field pattern that does not compile
 * or a block that makes the matcher fail.
 *
 * <p>Carries the source kind being parsed and the field whose rule failed so the
 * caller can fix the input or the rule.
 */
@Getter
public class ContextParseException extends RuntimeException {

    private final SourceKind sourceKind;
    private final String field;

    public ContextParseException(SourceKind sourceKind, String field, String message, Throwable cause) {
        super(message, cause);
        this.sourceKind = sourceKind;
        this.field = field;
    }
}
