package com.starscape.albumpublisher.features.publish.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.starscape.albumpublisher.common.config.PublishingProperties;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.common.exception.ProcessingException;
import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;
import com.starscape.albumpublisher.features.derive.domain.CaptureMetadata;
import com.starscape.albumpublisher.features.derive.domain.ImageRecord;
import com.starscape.albumpublisher.features.derive.domain.Orientation;
import com.starscape.albumpublisher.features.derive.domain.RenditionLabel;
import com.starscape.albumpublisher.features.derive.domain.RenditionResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class TomlManifestWriterTest {

    @TempDir
    Path siteRoot;

    private PublishingProperties properties;
    private TomlManifestWriter writer;

    @BeforeEach
    void setUp() {
        properties = new PublishingProperties();
        properties.setSiteRoot(siteRoot);
        writer = new TomlManifestWriter(properties);
    }

    @Test
    void shouldWriteManifestWithSiteKeys() throws IOException {
        Map<String, Object> exif = new LinkedHashMap<>();
        exif.put("Make", "Camera Co");
        exif.put("Orientation", 6L);
        exif.put("FNumber", 2.8);
        ImageRecord dated = new ImageRecord(
                Path.of("/photos/trip/cover.jpg"),
                new CaptureMetadata(ZonedDateTime.of(2020, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC), Orientation.ROTATE_90, exif),
                Map.of(
                        RenditionLabel.SMALL, new RenditionResult("album/trip/cover_small.jpg", 450, 600),
                        RenditionLabel.MEDIUM, new RenditionResult("album/trip/cover_medium.jpg", 600, 800),
                        RenditionLabel.LARGE, new RenditionResult("album/trip/cover_large.jpg", 1152, 1536)),
                List.of());
        ImageRecord undated = new ImageRecord(
                Path.of("/photos/trip/x.jpg"),
                CaptureMetadata.empty(),
                Map.of(RenditionLabel.SMALL, new RenditionResult("album/trip/x_small.jpg", 600, 400)),
                List.of());
        AlbumManifest manifest = new AlbumManifest(Path.of("/photos/trip"), "trip", List.of(dated, undated), List.of());

        Path file = writer.write(manifest);

        Assertions.assertEquals(siteRoot.resolve("data/album/trip/album.toml"), file);
        JsonNode root = new TomlMapper().readTree(file.toFile());
        Assertions.assertEquals("/photos/trip", root.get("Path").asText());
        Assertions.assertEquals("trip", root.get("Slug").asText());
        Assertions.assertEquals(2, root.get("Images").size());

        JsonNode first = root.get("Images").get(0);
        Assertions.assertEquals("/photos/trip/cover.jpg", first.get("Path").asText());
        Assertions.assertEquals("2020-01-02T03:04:05Z", first.get("DateTime").asText());
        Assertions.assertEquals("album/trip/cover_medium.jpg", first.get("Medium").get("RelativeURL").asText());
        Assertions.assertEquals(1152, first.get("Large").get("Width").asInt());
        Assertions.assertEquals(1536, first.get("Large").get("Height").asInt());
        Assertions.assertEquals("Camera Co", first.get("Exif").get("Make").asText());
        Assertions.assertEquals(6, first.get("Exif").get("Orientation").asInt());
        Assertions.assertEquals(2.8, first.get("Exif").get("FNumber").asDouble(), 1e-9);

        JsonNode second = root.get("Images").get(1);
        Assertions.assertFalse(second.has("DateTime"));
        Assertions.assertFalse(second.has("Medium"));
        Assertions.assertFalse(second.has("Large"));
        Assertions.assertEquals(400, second.get("Small").get("Height").asInt());
    }

    @Test
    void shouldWriteCaptureTimeAsNativeDateTimeWithSeconds() throws IOException {
        ImageRecord midnight = new ImageRecord(
                Path.of("/photos/trip/a.jpg"),
                new CaptureMetadata(ZonedDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.ofHours(2)), Orientation.NONE, Map.of()),
                Map.of(RenditionLabel.SMALL, new RenditionResult("album/trip/a_small.jpg", 600, 400)),
                List.of());

        Path file = writer.write(new AlbumManifest(Path.of("/photos/trip"), "trip", List.of(midnight), List.of()));

        String text = Files.readString(file);
        Assertions.assertTrue(text.contains("DateTime = 2020-01-01T00:00:00+02:00"), text);
        Assertions.assertFalse(text.contains("\"2020-01-01T"), text);
        JsonNode root = new TomlMapper().readTree(file.toFile());
        Assertions.assertEquals("2020-01-01T00:00:00+02:00", root.get("Images").get(0).get("DateTime").asText());
    }

    @Test
    void shouldReplacePreviousManifest() throws IOException {
        Path manifestDir = Files.createDirectories(properties.manifestDir("trip"));
        Files.writeString(manifestDir.resolve("album.toml"), "Stale = true\n".repeat(100));

        Path file = writer.write(new AlbumManifest(Path.of("/photos/trip"), "trip", List.of(), List.of()));

        JsonNode root = new TomlMapper().readTree(file.toFile());
        Assertions.assertFalse(root.has("Stale"));
        Assertions.assertEquals("trip", root.get("Slug").asText());
    }

    @Test
    void shouldReportManifestWriteFailure() throws IOException {
        Files.createDirectories(properties.manifestDir("trip").getParent());
        Files.writeString(properties.manifestDir("trip"), "a file where a directory belongs");

        ProcessingException ex = Assertions.assertThrows(ProcessingException.class,
                () -> writer.write(new AlbumManifest(Path.of("/photos/trip"), "trip", List.of(), List.of())));

        Assertions.assertEquals(ProcessingErrorKind.MANIFEST_WRITE, ex.getKind());
    }
}
