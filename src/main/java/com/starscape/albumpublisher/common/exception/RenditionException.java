package com.starscape.albumpublisher.common.exception;

/**
 * Failure to produce a single rendition. Either {@link ProcessingErrorKind#DECODE}
 * or {@link ProcessingErrorKind#DESTINATION_WRITE}.
 */
public class RenditionException extends ProcessingException {

    public RenditionException(ProcessingErrorKind kind, String message) {
        super(kind, message);
    }

    public RenditionException(ProcessingErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static RenditionException decode(String message, Throwable cause) {
        return new RenditionException(ProcessingErrorKind.DECODE, message, cause);
    }

    public static RenditionException write(String message, Throwable cause) {
        return new RenditionException(ProcessingErrorKind.DESTINATION_WRITE, message, cause);
    }
}
