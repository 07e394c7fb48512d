package com.starscape.albumpublisher.features.derive.domain;

import com.starscape.albumpublisher.common.domain.ValueObject;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * The renditions selected for one source file, keyed by label.
 */
public record DerivationPlan(
    Map<RenditionLabel, RenditionSpec> renditions
) implements ValueObject {

    public DerivationPlan {
        if (renditions == null || renditions.isEmpty()) {
            throw new IllegalArgumentException("Plan must contain at least one rendition");
        }
        renditions.forEach((label, spec) -> {
            if (spec.label() != label) {
                throw new IllegalArgumentException("Spec " + spec + " filed under " + label);
            }
        });
        renditions = Collections.unmodifiableMap(new EnumMap<>(renditions));
    }

    public Set<RenditionLabel> labels() {
        return renditions.keySet();
    }

    public Collection<RenditionSpec> specs() {
        return renditions.values();
    }
}
