package com.starscape.albumpublisher.features.derive.infra;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.StringValue;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifInteropDirectory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.albumpublisher.common.config.ProcessingProperties;
import com.starscape.albumpublisher.features.derive.domain.CaptureMetadata;
import com.starscape.albumpublisher.features.derive.domain.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads capture metadata from the EXIF container embedded in a JPEG.
 * Never fails: an unreadable container yields {@link CaptureMetadata#empty()}.
 */
@Component
public class ExifMetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(ExifMetadataExtractor.class);

    static final DateTimeFormatter EXIF_TIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private static final List<Class<? extends Directory>> WALKED_DIRECTORIES = List.of(
            ExifIFD0Directory.class,
            ExifSubIFDDirectory.class,
            GpsDirectory.class,
            ExifInteropDirectory.class
    );

    private static final String MAKERNOTE_PACKAGE = "com.drew.metadata.exif.makernotes";

    private final ZoneId captureZone;

    @Autowired
    public ExifMetadataExtractor(ProcessingProperties processingProperties) {
        this(processingProperties.captureZoneId());
    }

    ExifMetadataExtractor(ZoneId captureZone) {
        this.captureZone = captureZone;
    }

    public CaptureMetadata extract(Path source, byte[] imageBytes) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(imageBytes));
        } catch (ImageProcessingException | IOException e) {
            log.warn("Error reading EXIF from {}: {}", source, e.getMessage());
            return CaptureMetadata.empty();
        }

        ZonedDateTime captureTime = extractCaptureTime(source, metadata);
        Orientation orientation = extractOrientation(metadata);
        Map<String, Object> tags = walkTags(metadata);

        return new CaptureMetadata(captureTime, orientation, tags);
    }

    /**
     * DateTimeOriginal when present, DateTime otherwise. An unparseable value
     * leaves the capture time absent.
     */
    private ZonedDateTime extractCaptureTime(Path source, Metadata metadata) {
        String raw = null;
        for (ExifSubIFDDirectory directory : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
            if (directory.containsTag(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL)) {
                raw = directory.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
                break;
            }
        }
        if (raw == null) {
            ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (ifd0 != null && ifd0.containsTag(ExifIFD0Directory.TAG_DATETIME)) {
                raw = ifd0.getString(ExifIFD0Directory.TAG_DATETIME);
            }
        }
        if (raw == null) {
            log.debug("No capture time in {}", source);
            return null;
        }
        return parseCaptureTime(source, raw);
    }

    ZonedDateTime parseCaptureTime(Path source, String raw) {
        String value = stripTrailingNuls(raw);
        try {
            return LocalDateTime.parse(value, EXIF_TIME_FORMAT).atZone(captureZone);
        } catch (DateTimeParseException e) {
            log.info("Unparseable capture time '{}' in {}", value, source);
            return null;
        }
    }

    private Orientation extractOrientation(Metadata metadata) {
        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (ifd0 == null) {
            return Orientation.NONE;
        }
        return Orientation.fromExifTag(ifd0.getInteger(ExifIFD0Directory.TAG_ORIENTATION));
    }

    /**
     * Standard EXIF directories first, then any vendor maker-note directories.
     * The first directory to supply a tag name wins.
     */
    Map<String, Object> walkTags(Metadata metadata) {
        Map<String, Object> tags = new LinkedHashMap<>();
        for (Class<? extends Directory> type : WALKED_DIRECTORIES) {
            for (Directory directory : metadata.getDirectoriesOfType(type)) {
                collectTags(directory, tags);
            }
        }
        for (Directory directory : metadata.getDirectories()) {
            if (isMakernote(directory)) {
                collectTags(directory, tags);
            }
        }
        return tags;
    }

    private static void collectTags(Directory directory, Map<String, Object> tags) {
        for (Tag tag : directory.getTags()) {
            Object value = toScalar(directory.getObject(tag.getTagType()));
            if (value != null) {
                tags.putIfAbsent(normalizeTagName(tag.getTagName()), value);
            }
        }
        if (directory.hasErrors()) {
            log.debug("EXIF directory {} reported errors: {}", directory.getName(), directory.getErrors());
        }
    }

    static boolean isMakernote(Directory directory) {
        return MAKERNOTE_PACKAGE.equals(directory.getClass().getPackageName());
    }

    /**
     * Converts a raw tag value into a String, Long or Double, or null when the
     * value has no scalar representation. Non-finite numbers (a rational with a
     * zero denominator) are dropped: the manifest format cannot hold them.
     */
    static Object toScalar(Object raw) {
        if (raw instanceof StringValue stringValue) {
            return toText(stringValue.getBytes());
        }
        if (raw instanceof String string) {
            return string.indexOf('\0') >= 0 ? "" : string;
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Rational rational) {
            return finite(rational.doubleValue());
        }
        if (raw instanceof Float || raw instanceof Double) {
            return finite(((Number) raw).doubleValue());
        }
        if (raw instanceof short[] values && values.length > 0) {
            return (long) values[0];
        }
        if (raw instanceof int[] values && values.length > 0) {
            return (long) values[0];
        }
        if (raw instanceof long[] values && values.length > 0) {
            return values[0];
        }
        if (raw instanceof Rational[] values && values.length > 0) {
            return finite(values[0].doubleValue());
        }
        if (raw instanceof float[] values && values.length > 0) {
            return finite(values[0]);
        }
        if (raw instanceof double[] values && values.length > 0) {
            return finite(values[0]);
        }
        return null;
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static String toText(byte[] bytes) {
        for (byte b : bytes) {
            if (b == 0) {
                return "";
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    /**
     * "Date/Time Original" becomes "DateTimeOriginal".
     */
    static String normalizeTagName(String tagName) {
        StringBuilder name = new StringBuilder(tagName.length());
        boolean upperNext = true;
        for (int i = 0; i < tagName.length(); i++) {
            char c = tagName.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                upperNext = true;
                continue;
            }
            name.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return name.toString();
    }

    static String stripTrailingNuls(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '\0') {
            end--;
        }
        return value.substring(0, end);
    }
}
