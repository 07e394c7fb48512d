package com.starscape.albumpublisher.features.publish.domain.events;

import com.starscape.albumpublisher.common.domain.DomainEvent;

import java.time.Instant;

/**
 * Domain event published when an album's renditions and manifest are written.
 * Counts describe files and renditions that could not be produced.
 */
public record AlbumPublished(
    String slug,
    int imageCount,
    int failedFileCount,
    long failedRenditionCount,
    Instant occurredOn
) implements DomainEvent {

    @Override
    public String getEventType() {
        return "AlbumPublished";
    }

    @Override
    public String getAggregateId() {
        return slug;
    }

    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
