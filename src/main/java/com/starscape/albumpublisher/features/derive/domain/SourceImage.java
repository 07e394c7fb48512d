package com.starscape.albumpublisher.features.derive.domain;

import java.nio.file.Path;

/**
 * A source photograph loaded into memory for the duration of one task.
 */
public record SourceImage(
    Path path,
    byte[] content
) {

    /** File name without its extension, the stem of every rendition name. */
    public String baseName() {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
