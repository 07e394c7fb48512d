package com.starscape.albumpublisher.features.publish.domain.events;

import com.starscape.albumpublisher.common.domain.DomainEvent;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;

import java.time.Instant;

/**
 * Domain event published when an album is abandoned.
 */
public record AlbumFailed(
    String slug,
    ProcessingErrorKind errorKind,
    String errorMessage,
    Instant occurredOn
) implements DomainEvent {

    @Override
    public String getEventType() {
        return "AlbumFailed";
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
