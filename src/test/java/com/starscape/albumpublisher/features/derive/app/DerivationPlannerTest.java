package com.starscape.albumpublisher.features.derive.app;

import com.starscape.albumpublisher.common.config.ProcessingProperties;
import com.starscape.albumpublisher.features.derive.domain.DerivationPlan;
import com.starscape.albumpublisher.features.derive.domain.RenditionLabel;
import com.starscape.albumpublisher.features.derive.domain.RenditionSpec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

class DerivationPlannerTest {

    private final ProcessingProperties properties = new ProcessingProperties();
    private final DerivationPlanner planner = new DerivationPlanner(properties);

    @Test
    void shouldPlanSmallAndLargeForRegularImages() {
        DerivationPlan plan = planner.plan(Path.of("album", "x.jpg"));

        Assertions.assertEquals(List.of(RenditionLabel.SMALL, RenditionLabel.LARGE), List.copyOf(plan.labels()));
        Assertions.assertEquals(new RenditionSpec(RenditionLabel.SMALL, 600, 80), List.copyOf(plan.specs()).get(0));
        Assertions.assertEquals(new RenditionSpec(RenditionLabel.LARGE, 1536, 80), List.copyOf(plan.specs()).get(1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"cover.jpg", "Cover.JPG", "COVER.jpg"})
    void shouldAddMediumForCover(String fileName) {
        DerivationPlan plan = planner.plan(Path.of("album", fileName));

        Assertions.assertEquals(
                List.of(RenditionLabel.SMALL, RenditionLabel.MEDIUM, RenditionLabel.LARGE),
                List.copyOf(plan.labels()));
        Assertions.assertEquals(800, List.copyOf(plan.specs()).get(1).width());
    }

    @Test
    void shouldNotTreatDirectoryNamedCoverAsCover() {
        Assertions.assertFalse(planner.isCover(Path.of("cover.jpg", "x.jpg")));
        Assertions.assertFalse(planner.isCover(Path.of("my-cover.jpg")));
    }

    @Test
    void shouldUseConfiguredWidthsAndQualities() {
        properties.setRenditionWidths(Map.of("small", 320, "medium", 640, "large", 1280));
        properties.setQualityByWidth(Map.of(320, 70));
        properties.setDefaultQuality(85);
        properties.setCoverFileName("index.jpg");

        DerivationPlan plan = planner.plan(Path.of("index.jpg"));

        Assertions.assertEquals(List.of(
                new RenditionSpec(RenditionLabel.SMALL, 320, 70),
                new RenditionSpec(RenditionLabel.MEDIUM, 640, 85),
                new RenditionSpec(RenditionLabel.LARGE, 1280, 85)), List.copyOf(plan.specs()));
    }

    @Test
    void shouldRejectMissingWidth() {
        properties.setRenditionWidths(Map.of("small", 600));

        Assertions.assertThrows(IllegalStateException.class, () -> planner.plan(Path.of("x.jpg")));
    }
}
