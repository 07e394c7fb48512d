package com.starscape.albumpublisher.common.domain;

/**
 * Marker for immutable values compared by content rather than identity.
 */
public interface ValueObject {
}
