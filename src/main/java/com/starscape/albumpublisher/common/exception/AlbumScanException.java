package com.starscape.albumpublisher.common.exception;

/**
 * Raised when an album's source directory is missing or cannot be listed.
 * Aborts that album only.
 */
public class AlbumScanException extends ProcessingException {

    public AlbumScanException(String message) {
        super(ProcessingErrorKind.ALBUM_SCAN, message);
    }

    public AlbumScanException(String message, Throwable cause) {
        super(ProcessingErrorKind.ALBUM_SCAN, message, cause);
    }
}
