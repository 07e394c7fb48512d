package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;

import java.nio.file.Path;

public record AlbumSource(
    String slug,
    Path sourceDir
) implements ValueObject {

    public AlbumSource {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("Slug cannot be blank");
        }
        if (sourceDir == null) {
            throw new IllegalArgumentException("Source directory cannot be null");
        }
    }
}
