package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;

public record RenditionResult(
    String relativeUrl,
    int width,
    int height
) implements ValueObject {

    public RenditionResult {
        if (relativeUrl == null || relativeUrl.isBlank()) {
            throw new IllegalArgumentException("Relative URL cannot be blank");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive");
        }
    }
}
