package com.starscape.albumpublisher.features.publish.domain;

import java.util.List;

public record PublishReport(
    List<AlbumOutcome> albums
) {

    public PublishReport {
        albums = albums == null ? List.of() : List.copyOf(albums);
    }

    public long publishedCount() {
        return albums.stream().filter(AlbumOutcome::succeeded).count();
    }

    public long failedCount() {
        return albums.size() - publishedCount();
    }

    public boolean hasFailures() {
        return failedCount() > 0;
    }
}
