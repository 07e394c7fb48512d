package com.starscape.albumpublisher.features.publish.domain;

import com.starscape.albumpublisher.features.derive.domain.AlbumSource;

import java.util.List;

/**
 * Discovers the albums to publish and their source directories.
 */
public interface AlbumFinder {

    List<AlbumSource> findAlbums();
}
