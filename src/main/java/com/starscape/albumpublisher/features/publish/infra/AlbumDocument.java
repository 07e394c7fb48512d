package com.starscape.albumpublisher.features.publish.infra;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;
import com.starscape.albumpublisher.features.derive.domain.ImageRecord;
import com.starscape.albumpublisher.features.derive.domain.RenditionLabel;
import com.starscape.albumpublisher.features.derive.domain.RenditionResult;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of an album manifest, keyed the way the site templates read it.
 */
@JsonPropertyOrder({"Path", "Slug", "Images"})
record AlbumDocument(
    @JsonProperty("Path") String path,
    @JsonProperty("Slug") String slug,
    @JsonProperty("Images") List<ImageDocument> images
) {

    static AlbumDocument from(AlbumManifest manifest) {
        return new AlbumDocument(
                manifest.sourcePath().toString(),
                manifest.slug(),
                manifest.images().stream().map(ImageDocument::from).toList());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"Path", "DateTime", "Small", "Medium", "Large", "Exif"})
    record ImageDocument(
        @JsonProperty("Path") String path,
        @JsonProperty("DateTime") @JsonSerialize(using = TomlDateTimeSerializer.class) OffsetDateTime dateTime,
        @JsonProperty("Small") RenditionDocument small,
        @JsonProperty("Medium") RenditionDocument medium,
        @JsonProperty("Large") RenditionDocument large,
        @JsonProperty("Exif") Map<String, Object> exif
    ) {

        static ImageDocument from(ImageRecord record) {
            return new ImageDocument(
                    record.sourcePath().toString(),
                    record.metadata().captureTimeIfPresent()
                            .map(ZonedDateTime::toOffsetDateTime)
                            .orElse(null),
                    RenditionDocument.from(record, RenditionLabel.SMALL),
                    RenditionDocument.from(record, RenditionLabel.MEDIUM),
                    RenditionDocument.from(record, RenditionLabel.LARGE),
                    record.metadata().tags());
        }
    }

    @JsonPropertyOrder({"RelativeURL", "Width", "Height"})
    record RenditionDocument(
        @JsonProperty("RelativeURL") String relativeUrl,
        @JsonProperty("Width") int width,
        @JsonProperty("Height") int height
    ) {

        static RenditionDocument from(ImageRecord record, RenditionLabel label) {
            return record.rendition(label).map(RenditionDocument::of).orElse(null);
        }

        private static RenditionDocument of(RenditionResult result) {
            return new RenditionDocument(result.relativeUrl(), result.width(), result.height());
        }
    }
}
