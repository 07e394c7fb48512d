package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;

public record RenditionFailure(
    RenditionLabel label,
    ProcessingErrorKind kind,
    String message
) implements ValueObject {
}
