package com.starscape.albumpublisher.features.derive.infra;

import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.common.exception.RenditionException;
import com.starscape.albumpublisher.features.derive.domain.Orientation;
import com.starscape.albumpublisher.features.derive.domain.PixelSize;
import com.starscape.albumpublisher.integration.TestUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class JpegRenditionCodecTest {

    private static final Path SOURCE = Path.of("a.jpg");

    private final JpegRenditionCodec codec = new JpegRenditionCodec();

    @TempDir
    Path dir;

    @Test
    void shouldDecodeJpegBytes() throws IOException {
        BufferedImage image = codec.decode(SOURCE, TestUtils.createTestImage(120, 90));

        Assertions.assertEquals(120, image.getWidth());
        Assertions.assertEquals(90, image.getHeight());
    }

    @Test
    void shouldReportDecodeErrorForCorruptPayload() {
        byte[] corrupt = "not a jpeg at all".getBytes(StandardCharsets.US_ASCII);

        RenditionException ex = Assertions.assertThrows(RenditionException.class, () -> codec.decode(SOURCE, corrupt));

        Assertions.assertEquals(ProcessingErrorKind.DECODE, ex.getKind());
    }

    @Test
    void shouldResizeToTargetWidthKeepingAspectRatio() throws IOException {
        BufferedImage source = codec.decode(SOURCE, TestUtils.createTestImage(800, 600));

        BufferedImage resized = codec.resize(source, 600);

        Assertions.assertEquals(600, resized.getWidth());
        Assertions.assertEquals(450, resized.getHeight());
    }

    @Test
    void shouldUpscaleNarrowSources() throws IOException {
        BufferedImage source = codec.decode(SOURCE, TestUtils.createTestImage(300, 200));

        BufferedImage resized = codec.resize(source, 600);

        Assertions.assertEquals(new PixelSize(600, 400), new PixelSize(resized.getWidth(), resized.getHeight()));
    }

    @Test
    void shouldEncodeAndReadBackSize() throws IOException {
        BufferedImage source = codec.decode(SOURCE, TestUtils.createTestImage(800, 600));
        BufferedImage rotated = codec.rotate(codec.resize(source, 600), Orientation.ROTATE_90);
        Path destination = dir.resolve("out").resolve("a_small.jpg");

        codec.encode(rotated, 80, destination);

        Assertions.assertTrue(Files.isRegularFile(destination));
        Assertions.assertEquals(new PixelSize(450, 600), codec.readSize(destination));
        try (var leftovers = Files.list(destination.getParent())) {
            Assertions.assertEquals(1, leftovers.count(), "temporary file should be moved into place");
        }
    }

    @Test
    void shouldReportWriteErrorWhenDestinationIsNotWritable() throws IOException {
        BufferedImage image = codec.decode(SOURCE, TestUtils.createTestImage(20, 10));
        Path blocker = Files.writeString(dir.resolve("blocker"), "file, not a directory");

        RenditionException ex = Assertions.assertThrows(RenditionException.class,
                () -> codec.encode(image, 80, blocker.resolve("a_small.jpg")));

        Assertions.assertEquals(ProcessingErrorKind.DESTINATION_WRITE, ex.getKind());
    }

    @Test
    void shouldFailToReadSizeOfNonImage() throws IOException {
        Path text = Files.writeString(dir.resolve("a_small.jpg"), "plain text");

        Assertions.assertThrows(RenditionException.class, () -> codec.readSize(text));
    }
}
