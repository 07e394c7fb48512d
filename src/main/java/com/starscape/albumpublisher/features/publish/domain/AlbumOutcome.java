package com.starscape.albumpublisher.features.publish.domain;

import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;
import com.starscape.albumpublisher.features.derive.domain.AlbumSource;

import java.nio.file.Path;

/**
 * Result of publishing one album: either a manifest and the path it was
 * written to, or the reason the album was abandoned.
 */
public record AlbumOutcome(
    AlbumSource album,
    AlbumManifest manifest,
    Path manifestFile,
    ProcessingErrorKind errorKind,
    String errorMessage
) {

    public static AlbumOutcome published(AlbumSource album, AlbumManifest manifest, Path manifestFile) {
        return new AlbumOutcome(album, manifest, manifestFile, null, null);
    }

    public static AlbumOutcome failed(AlbumSource album, ProcessingErrorKind errorKind, String errorMessage) {
        return new AlbumOutcome(album, null, null, errorKind, errorMessage);
    }

    public boolean succeeded() {
        return errorKind == null;
    }
}
