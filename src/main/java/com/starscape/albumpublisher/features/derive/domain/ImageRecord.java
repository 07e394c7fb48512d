package com.starscape.albumpublisher.features.derive.domain;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of deriving one source file. A rendition that could not be produced
 * is absent from {@code renditions} and described in {@code failures}.
 */
public record ImageRecord(
    Path sourcePath,
    CaptureMetadata metadata,
    Map<RenditionLabel, RenditionResult> renditions,
    List<RenditionFailure> failures
) {

    public ImageRecord {
        if (sourcePath == null) {
            throw new IllegalArgumentException("Source path cannot be null");
        }
        if (metadata == null) {
            metadata = CaptureMetadata.empty();
        }
        renditions = renditions == null || renditions.isEmpty()
            ? Collections.unmodifiableMap(new EnumMap<>(RenditionLabel.class))
            : Collections.unmodifiableMap(new EnumMap<>(renditions));
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public Optional<RenditionResult> rendition(RenditionLabel label) {
        return Optional.ofNullable(renditions.get(label));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
