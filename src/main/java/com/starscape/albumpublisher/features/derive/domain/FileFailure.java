package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;

import java.nio.file.Path;

/**
 * A source file whose task aborted before any rendition could be attempted.
 */
public record FileFailure(
    Path sourcePath,
    ProcessingErrorKind kind,
    String message
) implements ValueObject {
}
