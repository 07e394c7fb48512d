package com.starscape.albumpublisher.features.derive.infra;

import com.starscape.albumpublisher.common.exception.AlbumScanException;
import com.starscape.albumpublisher.features.derive.domain.RenditionLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Lists the source photographs of an album directory.
 * Renditions written by earlier runs are never treated as sources.
 */
@Component
public class SourceDirectoryScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceDirectoryScanner.class);

    private static final List<String> RENDITION_SUFFIXES = Arrays.stream(RenditionLabel.values())
            .map(RenditionLabel::fileSuffix)
            .toList();

    public List<Path> scan(Path sourceDir) {
        if (!Files.isDirectory(sourceDir)) {
            throw new AlbumScanException("Source directory " + sourceDir + " not found");
        }
        try (Stream<Path> entries = Files.list(sourceDir)) {
            List<Path> candidates = entries
                    .filter(SourceDirectoryScanner::isCandidate)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
            log.debug("Found {} source images in {}", candidates.size(), sourceDir);
            return candidates;
        } catch (IOException e) {
            throw new AlbumScanException("Cannot list source directory " + sourceDir, e);
        }
    }

    static boolean isCandidate(Path entry) {
        if (Files.isDirectory(entry)) {
            return false;
        }
        String name = entry.getFileName().toString();
        if (!name.toLowerCase(Locale.ROOT).endsWith(".jpg")) {
            return false;
        }
        return RENDITION_SUFFIXES.stream().noneMatch(name::endsWith);
    }
}
