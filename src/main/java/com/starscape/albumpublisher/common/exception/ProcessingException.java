package com.starscape.albumpublisher.common.exception;

public class ProcessingException extends RuntimeException {

    private final ProcessingErrorKind kind;

    public ProcessingException(ProcessingErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProcessingException(ProcessingErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ProcessingErrorKind getKind() {
        return kind;
    }
}
