package com.phillippitts.docassist.exception;

/**
 * Base exception for all docassist application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DocAssistException extends RuntimeException {

    public DocAssistException(String message) {
        super(message);
    }

    public DocAssistException(String message, Throwable cause) {
        super(message, cause);
    }

    public DocAssistException(Throwable cause) {
        super(cause);
    }
}
