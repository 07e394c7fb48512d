package com.starscape.albumpublisher.features.derive.app;

import com.starscape.albumpublisher.common.config.PublishingProperties;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.common.exception.RenditionException;
import com.starscape.albumpublisher.common.exception.SourceReadException;
import com.starscape.albumpublisher.features.derive.domain.CaptureMetadata;
import com.starscape.albumpublisher.features.derive.domain.DerivationPlan;
import com.starscape.albumpublisher.features.derive.domain.ImageRecord;
import com.starscape.albumpublisher.features.derive.domain.Orientation;
import com.starscape.albumpublisher.features.derive.domain.PixelSize;
import com.starscape.albumpublisher.features.derive.domain.RenditionFailure;
import com.starscape.albumpublisher.features.derive.domain.RenditionLabel;
import com.starscape.albumpublisher.features.derive.domain.RenditionResult;
import com.starscape.albumpublisher.features.derive.domain.RenditionSpec;
import com.starscape.albumpublisher.features.derive.domain.SourceImage;
import com.starscape.albumpublisher.features.derive.infra.ExifMetadataExtractor;
import com.starscape.albumpublisher.features.derive.infra.JpegRenditionCodec;
import com.starscape.albumpublisher.features.derive.infra.RenditionCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives every planned rendition of a single source file.
 *
 * Runs on a worker thread and shares no mutable state with sibling tasks:
 * each source file owns the destination paths derived from its name.
 * A rendition that fails is logged and reported in the record; only an
 * unreadable source aborts the whole file.
 */
@Service
public class ImageDerivationService {

    private static final Logger log = LoggerFactory.getLogger(ImageDerivationService.class);

    private final DerivationPlanner planner;
    private final ExifMetadataExtractor metadataExtractor;
    private final JpegRenditionCodec codec;
    private final RenditionCache cache;
    private final PublishingProperties publishingProperties;

    public ImageDerivationService(
            DerivationPlanner planner,
            ExifMetadataExtractor metadataExtractor,
            JpegRenditionCodec codec,
            RenditionCache cache,
            PublishingProperties publishingProperties) {
        this.planner = planner;
        this.metadataExtractor = metadataExtractor;
        this.codec = codec;
        this.cache = cache;
        this.publishingProperties = publishingProperties;
    }

    /**
     * @param sourcePath source photograph
     * @param outputDir album directory the renditions are written to
     * @throws SourceReadException if the source cannot be read
     */
    public ImageRecord derive(Path sourcePath, Path outputDir) {
        SourceImage source = load(sourcePath);
        DerivationPlan plan = planner.plan(sourcePath);
        CaptureMetadata metadata = metadataExtractor.extract(sourcePath, source.content());
        String sourceDigest = RenditionCache.sourceDigest(source.content());

        Map<RenditionLabel, RenditionResult> renditions = new EnumMap<>(RenditionLabel.class);
        List<RenditionFailure> failures = new ArrayList<>();
        DecodedSource decoded = new DecodedSource(source);

        for (RenditionSpec spec : plan.specs()) {
            Path destination = outputDir.resolve(spec.label().destinationName(source.baseName()));
            try {
                renditions.put(spec.label(),
                        deriveRendition(decoded, spec, metadata.orientation(), sourceDigest, destination));
            } catch (RenditionException e) {
                log.error("Failed to derive {} rendition of {}: {}", spec.label().key(), sourcePath, e.getMessage(), e);
                failures.add(new RenditionFailure(spec.label(), e.getKind(), e.getMessage()));
            }
        }

        return new ImageRecord(sourcePath, metadata, renditions, failures);
    }

    private RenditionResult deriveRendition(
            DecodedSource decoded,
            RenditionSpec spec,
            Orientation orientation,
            String sourceDigest,
            Path destination) {
        String fingerprint = RenditionCache.fingerprint(sourceDigest, spec, orientation);
        String relativeUrl = publishingProperties.relativeUrl(destination);

        Optional<PixelSize> cached = cache.lookup(destination, fingerprint);
        if (cached.isPresent()) {
            log.debug("Reusing {}", destination);
            return new RenditionResult(relativeUrl, cached.get().width(), cached.get().height());
        }

        ensureDirectory(destination.getParent());
        BufferedImage resized = codec.resize(decoded.image(), spec.width());
        if (orientation != Orientation.NONE) {
            log.debug("Rotating {} by {}", destination, orientation.angle());
        }
        BufferedImage oriented = codec.rotate(resized, orientation);
        codec.encode(oriented, spec.quality(), destination);
        cache.store(destination, fingerprint);

        log.debug("Wrote {} ({}x{})", destination, oriented.getWidth(), oriented.getHeight());
        return new RenditionResult(relativeUrl, oriented.getWidth(), oriented.getHeight());
    }

    private SourceImage load(Path sourcePath) {
        try {
            return new SourceImage(sourcePath, Files.readAllBytes(sourcePath));
        } catch (IOException e) {
            throw new SourceReadException("Could not read source image " + sourcePath, e);
        }
    }

    private void ensureDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RenditionException(ProcessingErrorKind.DESTINATION_WRITE,
                    "Could not create output directory " + directory, e);
        }
    }

    /**
     * Decodes the source on first use, so a file whose renditions are all
     * cached is never decoded. A decode failure is remembered and rethrown
     * for every remaining rendition.
     */
    private final class DecodedSource {

        private final SourceImage source;
        private BufferedImage image;
        private RenditionException failure;

        private DecodedSource(SourceImage source) {
            this.source = source;
        }

        BufferedImage image() {
            if (failure != null) {
                throw failure;
            }
            if (image == null) {
                try {
                    image = codec.decode(source.path(), source.content());
                } catch (RenditionException e) {
                    failure = e;
                    throw e;
                }
            }
            return image;
        }
    }
}
