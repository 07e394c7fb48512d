package com.starscape.albumpublisher.features.derive.infra;

import com.starscape.albumpublisher.features.derive.domain.Orientation;

import java.awt.image.BufferedImage;

/**
 * Remaps pixels so an image with the given EXIF orientation displays upright.
 * W x H are the input dimensions:
 * <ul>
 *   <li>90: out(x, y) = in(y, H-1-x)</li>
 *   <li>-90: out(x, y) = in(W-1-y, x)</li>
 *   <li>180: out(x, y) = in(W-1-x, H-1-y)</li>
 * </ul>
 */
final class OrientationTransform {

    private OrientationTransform() {
    }

    static BufferedImage apply(BufferedImage source, Orientation orientation) {
        if (orientation == Orientation.NONE) {
            return source;
        }
        int w = source.getWidth();
        int h = source.getHeight();
        int outW = orientation.swapsDimensions() ? h : w;
        int outH = orientation.swapsDimensions() ? w : h;

        int[] in = source.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[outW * outH];
        for (int y = 0; y < outH; y++) {
            for (int x = 0; x < outW; x++) {
                int sx;
                int sy;
                switch (orientation) {
                    case ROTATE_90 -> {
                        sx = y;
                        sy = h - 1 - x;
                    }
                    case ROTATE_270 -> {
                        sx = w - 1 - y;
                        sy = x;
                    }
                    case ROTATE_180 -> {
                        sx = w - 1 - x;
                        sy = h - 1 - y;
                    }
                    default -> throw new IllegalStateException("Unexpected orientation " + orientation);
                }
                out[y * outW + x] = in[sy * w + sx];
            }
        }

        BufferedImage result = new BufferedImage(outW, outH, BufferedImage.TYPE_INT_RGB);
        result.setRGB(0, 0, outW, outH, out, 0, outW);
        return result;
    }
}
