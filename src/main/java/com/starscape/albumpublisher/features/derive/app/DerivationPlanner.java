package com.starscape.albumpublisher.features.derive.app;

import com.starscape.albumpublisher.common.config.ProcessingProperties;
import com.starscape.albumpublisher.features.derive.domain.DerivationPlan;
import com.starscape.albumpublisher.features.derive.domain.RenditionLabel;
import com.starscape.albumpublisher.features.derive.domain.RenditionSpec;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Selects the renditions for a source file: every image gets small and large,
 * the album cover additionally gets medium.
 */
@Component
public class DerivationPlanner {

    private final ProcessingProperties processingProperties;

    public DerivationPlanner(ProcessingProperties processingProperties) {
        this.processingProperties = processingProperties;
    }

    public DerivationPlan plan(Path source) {
        Map<RenditionLabel, RenditionSpec> renditions = new EnumMap<>(RenditionLabel.class);
        renditions.put(RenditionLabel.SMALL, specFor(RenditionLabel.SMALL));
        if (isCover(source)) {
            renditions.put(RenditionLabel.MEDIUM, specFor(RenditionLabel.MEDIUM));
        }
        renditions.put(RenditionLabel.LARGE, specFor(RenditionLabel.LARGE));
        return new DerivationPlan(renditions);
    }

    public boolean isCover(Path source) {
        return source.getFileName().toString().equalsIgnoreCase(processingProperties.getCoverFileName());
    }

    private RenditionSpec specFor(RenditionLabel label) {
        int width = processingProperties.widthFor(label.key());
        return new RenditionSpec(label, width, processingProperties.qualityFor(width));
    }
}
