package com.purchasingpower.copilot.exception;

import lombok.Getter;

/**
 * Terminal failure of a whole query, raised only when the tool invocation mechanism itself is
 * unavailable. Individual tool failures never surface as this exception.
 */
@Getter
public class OrchestrationException extends RuntimeException {

    private final String question;

    public OrchestrationException(String question, String message, Throwable cause) {
        super(message, cause);
        this.question = question;
    }
}
