package com.starscape.albumpublisher.features.publish.domain;

import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;

import java.nio.file.Path;

/**
 * Persists an album manifest for the static site generator.
 */
public interface ManifestWriter {

    /**
     * @return the file the manifest was written to
     * @throws com.starscape.albumpublisher.common.exception.ProcessingException with kind MANIFEST_WRITE on failure
     */
    Path write(AlbumManifest manifest);
}
