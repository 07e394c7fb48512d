package com.starscape.albumpublisher.features.derive.infra;

import com.starscape.albumpublisher.features.derive.domain.Orientation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

class OrientationTransformTest {

    private static final int W = 3;
    private static final int H = 2;

    private BufferedImage source;

    @BeforeEach
    void setUp() {
        // Every pixel encodes its own coordinates
        source = new BufferedImage(W, H, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < H; y++) {
            for (int x = 0; x < W; x++) {
                source.setRGB(x, y, pixel(x, y));
            }
        }
    }

    @Test
    void shouldReturnSameImageWhenUpright() {
        Assertions.assertSame(source, OrientationTransform.apply(source, Orientation.NONE));
    }

    @Test
    void shouldRotateClockwiseForTag6() {
        BufferedImage rotated = OrientationTransform.apply(source, Orientation.ROTATE_90);

        Assertions.assertEquals(H, rotated.getWidth());
        Assertions.assertEquals(W, rotated.getHeight());
        for (int y = 0; y < W; y++) {
            for (int x = 0; x < H; x++) {
                Assertions.assertEquals(pixel(y, H - 1 - x), rgb(rotated, x, y), "at " + x + "," + y);
            }
        }
        // top-left of the result is the bottom-left of the source
        Assertions.assertEquals(pixel(0, H - 1), rgb(rotated, 0, 0));
    }

    @Test
    void shouldRotateCounterClockwiseForTag8() {
        BufferedImage rotated = OrientationTransform.apply(source, Orientation.ROTATE_270);

        Assertions.assertEquals(H, rotated.getWidth());
        Assertions.assertEquals(W, rotated.getHeight());
        for (int y = 0; y < W; y++) {
            for (int x = 0; x < H; x++) {
                Assertions.assertEquals(pixel(W - 1 - y, x), rgb(rotated, x, y), "at " + x + "," + y);
            }
        }
        // top-left of the result is the top-right of the source
        Assertions.assertEquals(pixel(W - 1, 0), rgb(rotated, 0, 0));
    }

    @Test
    void shouldFlipBothAxesForTag3() {
        BufferedImage rotated = OrientationTransform.apply(source, Orientation.ROTATE_180);

        Assertions.assertEquals(W, rotated.getWidth());
        Assertions.assertEquals(H, rotated.getHeight());
        for (int y = 0; y < H; y++) {
            for (int x = 0; x < W; x++) {
                Assertions.assertEquals(pixel(W - 1 - x, H - 1 - y), rgb(rotated, x, y), "at " + x + "," + y);
            }
        }
    }

    @Test
    void shouldRestoreOriginalAfterOppositeQuarterTurns() {
        BufferedImage roundTrip = OrientationTransform.apply(
                OrientationTransform.apply(source, Orientation.ROTATE_90), Orientation.ROTATE_270);

        for (int y = 0; y < H; y++) {
            for (int x = 0; x < W; x++) {
                Assertions.assertEquals(pixel(x, y), rgb(roundTrip, x, y));
            }
        }
    }

    private static int pixel(int x, int y) {
        return (x * 40) << 16 | (y * 40) << 8 | 7;
    }

    private static int rgb(BufferedImage image, int x, int y) {
        return image.getRGB(x, y) & 0xFFFFFF;
    }
}
