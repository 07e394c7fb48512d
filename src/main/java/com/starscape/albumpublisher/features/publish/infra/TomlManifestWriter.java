package com.starscape.albumpublisher.features.publish.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.starscape.albumpublisher.common.config.PublishingProperties;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.common.exception.ProcessingException;
import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;
import com.starscape.albumpublisher.features.publish.domain.ManifestWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes {@code <data-root>/<section>/<slug>/album.toml}, replacing any previous manifest.
 */
@Component
public class TomlManifestWriter implements ManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(TomlManifestWriter.class);

    static final String MANIFEST_FILE_NAME = "album.toml";

    private final PublishingProperties publishingProperties;
    private final TomlMapper tomlMapper = new TomlMapper();

    public TomlManifestWriter(PublishingProperties publishingProperties) {
        this.publishingProperties = publishingProperties;
    }

    @Override
    public Path write(AlbumManifest manifest) {
        Path manifestDir = publishingProperties.manifestDir(manifest.slug());
        Path manifestFile = manifestDir.resolve(MANIFEST_FILE_NAME);
        log.info("Writing {} for {}", MANIFEST_FILE_NAME, manifest.slug());
        try {
            String document = tomlMapper.writeValueAsString(AlbumDocument.from(manifest));
            Files.createDirectories(manifestDir);
            Files.writeString(manifestFile, document, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return manifestFile;
        } catch (JsonProcessingException e) {
            throw new ProcessingException(ProcessingErrorKind.MANIFEST_WRITE,
                    "Could not serialize manifest for " + manifest.slug(), e);
        } catch (IOException e) {
            throw new ProcessingException(ProcessingErrorKind.MANIFEST_WRITE,
                    "Could not write " + manifestFile, e);
        }
    }
}
