package com.starscape.albumpublisher.features.derive.domain;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PixelSizeTest {

    @ParameterizedTest
    @CsvSource({
        "800, 600, 600, 450",
        "1000, 333, 600, 200",
        "4000, 3000, 1536, 1152",
        "3000, 4000, 600, 800",
        "300, 200, 600, 400",
        "1001, 1, 600, 1",
        "7, 3, 5, 2"
    })
    void shouldKeepAspectRatioWhenScalingToWidth(int width, int height, int targetWidth, int expectedHeight) {
        PixelSize scaled = new PixelSize(width, height).scaledToWidth(targetWidth);

        Assertions.assertEquals(targetWidth, scaled.width());
        Assertions.assertEquals(Math.max(1, Math.round((double) targetWidth * height / width)), scaled.height());
        Assertions.assertEquals(expectedHeight, scaled.height());
    }

    @Test
    void shouldSwapDimensionsOnlyForQuarterTurns() {
        PixelSize size = new PixelSize(600, 450);

        Assertions.assertEquals(new PixelSize(450, 600), size.rotatedBy(Orientation.ROTATE_90));
        Assertions.assertEquals(new PixelSize(450, 600), size.rotatedBy(Orientation.ROTATE_270));
        Assertions.assertEquals(size, size.rotatedBy(Orientation.ROTATE_180));
        Assertions.assertEquals(size, size.rotatedBy(Orientation.NONE));
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PixelSize(0, 10));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PixelSize(10, -1));
    }
}
