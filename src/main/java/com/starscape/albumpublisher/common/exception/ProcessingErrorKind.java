package com.starscape.albumpublisher.common.exception;

/**
 * Failure categories of the derivation pipeline, ordered roughly by the scope they abort.
 */
public enum ProcessingErrorKind {
    METADATA_DECODE,
    TIMESTAMP_PARSE,
    DECODE,
    DESTINATION_WRITE,
    SOURCE_READ,
    ALBUM_SCAN,
    MANIFEST_WRITE,
    INTERNAL
}
