package com.starscape.albumpublisher.features.derive.app;

import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.common.exception.ProcessingException;
import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;
import com.starscape.albumpublisher.features.derive.domain.AlbumSource;
import com.starscape.albumpublisher.features.derive.domain.FileFailure;
import com.starscape.albumpublisher.features.derive.domain.ImageRecord;
import com.starscape.albumpublisher.features.derive.infra.SourceDirectoryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Derives all images of one album: one task per source file, joined by
 * counting completions, then ordered by capture time.
 */
@Service
public class AlbumDerivationService {

    private static final Logger log = LoggerFactory.getLogger(AlbumDerivationService.class);

    private final SourceDirectoryScanner scanner;
    private final ImageDerivationService imageDerivationService;
    private final ExecutorService fileExecutor;

    public AlbumDerivationService(
            SourceDirectoryScanner scanner,
            ImageDerivationService imageDerivationService,
            @Qualifier("fileExecutor") ExecutorService fileExecutor) {
        this.scanner = scanner;
        this.imageDerivationService = imageDerivationService;
        this.fileExecutor = fileExecutor;
    }

    /**
     * @throws com.starscape.albumpublisher.common.exception.AlbumScanException if the source directory cannot be listed
     */
    public AlbumManifest deriveAlbum(AlbumSource album, Path outputDir) throws InterruptedException {
        List<Path> sources = scanner.scan(album.sourceDir());
        log.info("Deriving {} images of album {} into {}", sources.size(), album.slug(), outputDir);

        CompletionService<FileOutcome> completions = new ExecutorCompletionService<>(fileExecutor);
        int dispatched = 0;
        for (Path source : sources) {
            int index = dispatched;
            completions.submit(() -> deriveFile(index, source, outputDir));
            dispatched++;
        }

        // Results arrive in completion order; slots keep listing order for stable sorting.
        ImageRecord[] records = new ImageRecord[dispatched];
        List<FileFailure> failures = new ArrayList<>();
        for (int remaining = dispatched; remaining > 0; remaining--) {
            FileOutcome outcome = join(completions.take());
            if (outcome.record() != null) {
                records[outcome.index()] = outcome.record();
            } else {
                failures.add(outcome.failure());
            }
        }

        List<ImageRecord> images = CaptureTimeOrdering.sort(
                Arrays.stream(records).filter(Objects::nonNull).toList());
        log.info("Album {}: {} images derived, {} files failed", album.slug(), images.size(), failures.size());
        return new AlbumManifest(album.sourceDir(), album.slug(), images, failures);
    }

    private FileOutcome deriveFile(int index, Path source, Path outputDir) {
        try {
            return new FileOutcome(index, imageDerivationService.derive(source, outputDir), null);
        } catch (ProcessingException e) {
            log.error("Skipping {}: {}", source, e.getMessage(), e);
            return new FileOutcome(index, null, new FileFailure(source, e.getKind(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure deriving {}", source, e);
            return new FileOutcome(index, null,
                    new FileFailure(source, ProcessingErrorKind.INTERNAL, String.valueOf(e.getMessage())));
        }
    }

    private FileOutcome join(Future<FileOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // deriveFile catches every RuntimeException; only an Error gets here
            throw new IllegalStateException("File task failed", e.getCause());
        }
    }

    private record FileOutcome(int index, ImageRecord record, FileFailure failure) {
    }
}
