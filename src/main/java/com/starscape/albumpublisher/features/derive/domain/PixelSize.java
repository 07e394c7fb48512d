package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;

public record PixelSize(
    int width,
    int height
) implements ValueObject {

    public PixelSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive");
        }
    }

    /**
     * Size of an image scaled to {@code targetWidth} with its aspect ratio kept:
     * height = round(targetWidth * height / width), never less than one pixel.
     */
    public PixelSize scaledToWidth(int targetWidth) {
        long scaledHeight = Math.round((double) targetWidth * height / width);
        return new PixelSize(targetWidth, (int) Math.max(1, scaledHeight));
    }

    public PixelSize rotatedBy(Orientation orientation) {
        return orientation.swapsDimensions() ? new PixelSize(height, width) : this;
    }
}
