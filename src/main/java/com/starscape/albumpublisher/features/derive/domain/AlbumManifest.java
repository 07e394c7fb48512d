package com.starscape.albumpublisher.features.derive.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered description of one album's images and their renditions.
 * Images are sorted by capture time; {@code failures} lists source files that
 * produced no record and is not part of the published document.
 */
public record AlbumManifest(
    Path sourcePath,
    String slug,
    List<ImageRecord> images,
    List<FileFailure> failures
) {

    public AlbumManifest {
        images = images == null ? List.of() : List.copyOf(images);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public long failedRenditionCount() {
        return images.stream().mapToLong(image -> image.failures().size()).sum();
    }
}
