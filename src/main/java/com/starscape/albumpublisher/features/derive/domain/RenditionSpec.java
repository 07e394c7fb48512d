package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;

public record RenditionSpec(
    RenditionLabel label,
    int width,
    int quality
) implements ValueObject {

    public RenditionSpec {
        if (label == null) {
            throw new IllegalArgumentException("Label cannot be null");
        }
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive");
        }
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("Quality must be between 1 and 100");
        }
    }
}
