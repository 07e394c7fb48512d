package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata extracted from a source image's EXIF container.
 *
 * @param captureTime shooting time, null when absent or unparseable
 * @param tags scalar tag values: {@link String}, {@link Long} or {@link Double}
 */
public record CaptureMetadata(
    ZonedDateTime captureTime,
    Orientation orientation,
    Map<String, Object> tags
) implements ValueObject {

    public CaptureMetadata {
        if (orientation == null) {
            orientation = Orientation.NONE;
        }
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static CaptureMetadata empty() {
        return new CaptureMetadata(null, Orientation.NONE, Map.of());
    }

    public Optional<ZonedDateTime> captureTimeIfPresent() {
        return Optional.ofNullable(captureTime);
    }
}
