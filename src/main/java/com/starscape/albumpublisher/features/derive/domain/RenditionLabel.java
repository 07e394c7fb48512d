package com.starscape.albumpublisher.features.derive.domain;

import java.util.Locale;

/**
 * Size classes a source image is derived into. The label names the
 * destination file suffix: {@code <basename>_<label>.jpg}.
 */
public enum RenditionLabel {
    SMALL,
    MEDIUM,
    LARGE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String fileSuffix() {
        return "_" + key() + ".jpg";
    }

    public String destinationName(String baseName) {
        return baseName + fileSuffix();
    }
}
