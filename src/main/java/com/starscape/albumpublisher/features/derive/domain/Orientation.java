package com.starscape.albumpublisher.features.derive.domain;

/**
 * Rotation needed to display an image upright, derived from the EXIF Orientation tag.
 * Mirrored orientations (2, 4, 5, 7) are not corrected and map to {@link #NONE}.
 */
public enum Orientation {
    NONE(0),
    ROTATE_90(90),
    ROTATE_180(180),
    ROTATE_270(-90);

    private final int angle;

    Orientation(int angle) {
        this.angle = angle;
    }

    /** Signed rotation angle in degrees; clockwise is positive. */
    public int angle() {
        return angle;
    }

    public boolean swapsDimensions() {
        return this == ROTATE_90 || this == ROTATE_270;
    }

    public static Orientation fromExifTag(Integer tagValue) {
        if (tagValue == null) {
            return NONE;
        }
        return switch (tagValue) {
            case 3 -> ROTATE_180;
            case 6 -> ROTATE_90;
            case 8 -> ROTATE_270;
            default -> NONE;
        };
    }
}
