package com.starscape.albumpublisher.common.exception;

public class SourceReadException extends ProcessingException {

    public SourceReadException(String message, Throwable cause) {
        super(ProcessingErrorKind.SOURCE_READ, message, cause);
    }
}
