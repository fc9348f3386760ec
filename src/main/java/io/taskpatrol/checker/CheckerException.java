package io.taskpatrol.checker;

import io.taskpatrol.model.ErrorClassification;

/**
 * Classified failure raised by a checker. The classification is final; the engine persists it as is.
 */
public class CheckerException extends Exception {
    private final ErrorClassification classification;
    private final String errorCode;

    public CheckerException(ErrorClassification classification, String errorCode, String message) {
        this(classification, errorCode, message, null);
    }

    public CheckerException(ErrorClassification classification, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.errorCode = errorCode;
    }

    public ErrorClassification classification() {
        return classification;
    }

    public String errorCode() {
        return errorCode;
    }
}
