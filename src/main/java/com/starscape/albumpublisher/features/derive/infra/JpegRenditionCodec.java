package com.starscape.albumpublisher.features.derive.infra;

import com.starscape.albumpublisher.common.exception.RenditionException;
import com.starscape.albumpublisher.features.derive.domain.Orientation;
import com.starscape.albumpublisher.features.derive.domain.PixelSize;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.resizers.configurations.ScalingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;

/**
 * Decodes, resizes, rotates and encodes JPEG renditions.
 */
@Component
public class JpegRenditionCodec {

    private static final Logger log = LoggerFactory.getLogger(JpegRenditionCodec.class);

    public BufferedImage decode(Path source, byte[] imageBytes) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw RenditionException.decode("Failed to decode " + source, e);
        }
        if (image == null) {
            throw RenditionException.decode("No decoder accepts " + source, null);
        }
        return image;
    }

    /**
     * Scales to {@code targetWidth}, keeping the aspect ratio.
     */
    public BufferedImage resize(BufferedImage image, int targetWidth) {
        PixelSize size = new PixelSize(image.getWidth(), image.getHeight()).scaledToWidth(targetWidth);
        try {
            return Thumbnails.of(image)
                    .forceSize(size.width(), size.height())
                    .scalingMode(ScalingMode.PROGRESSIVE_BILINEAR)
                    .imageType(BufferedImage.TYPE_INT_RGB)
                    .asBufferedImage();
        } catch (IOException e) {
            throw RenditionException.decode("Failed to resize to width " + targetWidth, e);
        }
    }

    public BufferedImage rotate(BufferedImage image, Orientation orientation) {
        return OrientationTransform.apply(image, orientation);
    }

    /**
     * Encodes as JPEG into a temporary file beside {@code destination} and moves it
     * into place, so a reader never observes a partially written rendition.
     */
    public void encode(BufferedImage image, int quality, Path destination) {
        Path directory = destination.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + destination.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                Thumbnails.of(image)
                        .scale(1.0)
                        .outputFormat("jpg")
                        .outputQuality(quality / 100.0)
                        .toOutputStream(out);
            }
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Encoded {} with quality {}", destination, quality);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw RenditionException.write("Failed to write " + destination, e);
        }
    }

    /**
     * Reads the pixel size of an existing image from its header without decoding pixels.
     */
    public PixelSize readSize(Path file) {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                throw RenditionException.decode("Cannot open " + file, null);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw RenditionException.decode("No decoder accepts " + file, null);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new PixelSize(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw RenditionException.decode("Failed to read size of " + file, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
