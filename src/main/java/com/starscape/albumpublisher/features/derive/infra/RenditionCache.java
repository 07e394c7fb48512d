package com.starscape.albumpublisher.features.derive.infra;

import com.starscape.albumpublisher.common.config.ProcessingProperties;
import com.starscape.albumpublisher.common.config.ProcessingProperties.CachePolicy;
import com.starscape.albumpublisher.common.exception.RenditionException;
import com.starscape.albumpublisher.features.derive.domain.Orientation;
import com.starscape.albumpublisher.features.derive.domain.PixelSize;
import com.starscape.albumpublisher.features.derive.domain.RenditionSpec;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides whether an existing rendition file can be reused.
 *
 * Under {@link CachePolicy#FINGERPRINT} every freshly encoded rendition gets a
 * {@code <file>.sha256} sidecar holding a digest of the source content and the
 * encoding parameters; a sidecar that disagrees with the current parameters
 * forces regeneration. A rendition without a sidecar is trusted as is, so
 * files produced before fingerprints existed are kept.
 */
@Component
public class RenditionCache {

    private static final Logger log = LoggerFactory.getLogger(RenditionCache.class);

    static final String SIDECAR_SUFFIX = ".sha256";

    private final CachePolicy policy;
    private final JpegRenditionCodec codec;

    public RenditionCache(ProcessingProperties processingProperties, JpegRenditionCodec codec) {
        this.policy = processingProperties.getCachePolicy();
        this.codec = codec;
    }

    public static String sourceDigest(byte[] sourceContent) {
        return DigestUtils.sha256Hex(sourceContent);
    }

    public static String fingerprint(String sourceDigest, RenditionSpec spec, Orientation orientation) {
        return DigestUtils.sha256Hex(sourceDigest + ":" + spec.width() + ":" + spec.quality() + ":" + orientation.angle());
    }

    /**
     * Size of a reusable rendition at {@code destination}, or empty when it has to be (re)generated.
     */
    public Optional<PixelSize> lookup(Path destination, String fingerprint) {
        if (!Files.isRegularFile(destination)) {
            return Optional.empty();
        }
        if (policy == CachePolicy.FINGERPRINT) {
            Optional<String> recorded = readSidecar(destination);
            if (recorded.isPresent() && !recorded.get().equals(fingerprint)) {
                log.info("Stale rendition {}, regenerating", destination);
                return Optional.empty();
            }
        }
        try {
            return Optional.of(codec.readSize(destination));
        } catch (RenditionException e) {
            log.warn("Unreadable rendition {}, regenerating: {}", destination, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Records the fingerprint of a freshly written rendition.
     */
    public void store(Path destination, String fingerprint) {
        if (policy != CachePolicy.FINGERPRINT) {
            return;
        }
        Path sidecar = sidecarOf(destination);
        try {
            Files.writeString(sidecar, fingerprint, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            log.warn("Could not write fingerprint {}; rendition will be trusted as is", sidecar, e);
        }
    }

    private Optional<String> readSidecar(Path destination) {
        Path sidecar = sidecarOf(destination);
        if (!Files.isRegularFile(sidecar)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(sidecar, StandardCharsets.US_ASCII).trim());
        } catch (IOException e) {
            log.warn("Could not read fingerprint {}", sidecar, e);
            return Optional.empty();
        }
    }

    public static Path sidecarOf(Path destination) {
        return destination.resolveSibling(destination.getFileName() + SIDECAR_SUFFIX);
    }
}
