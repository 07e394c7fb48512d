package com.starscape.albumpublisher.features.publish.app;

import com.starscape.albumpublisher.common.config.PublishingProperties;
import com.starscape.albumpublisher.common.exception.ProcessingErrorKind;
import com.starscape.albumpublisher.common.exception.ProcessingException;
import com.starscape.albumpublisher.features.derive.app.AlbumDerivationService;
import com.starscape.albumpublisher.features.derive.domain.AlbumManifest;
import com.starscape.albumpublisher.features.derive.domain.AlbumSource;
import com.starscape.albumpublisher.features.publish.domain.AlbumOutcome;
import com.starscape.albumpublisher.features.publish.domain.ManifestWriter;
import com.starscape.albumpublisher.features.publish.domain.PublishReport;
import com.starscape.albumpublisher.features.publish.domain.events.AlbumFailed;
import com.starscape.albumpublisher.features.publish.domain.events.AlbumPublished;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;

/**
 * Publishes albums concurrently: one task per album, each deriving its
 * images and writing its manifest. A failing album never affects the others.
 */
@Service
public class AlbumPublishingService {

    private static final Logger log = LoggerFactory.getLogger(AlbumPublishingService.class);

    private final AlbumDerivationService albumDerivationService;
    private final ManifestWriter manifestWriter;
    private final PublishingProperties publishingProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService albumExecutor;

    public AlbumPublishingService(
            AlbumDerivationService albumDerivationService,
            ManifestWriter manifestWriter,
            PublishingProperties publishingProperties,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("albumExecutor") ExecutorService albumExecutor) {
        this.albumDerivationService = albumDerivationService;
        this.manifestWriter = manifestWriter;
        this.publishingProperties = publishingProperties;
        this.eventPublisher = eventPublisher;
        this.albumExecutor = albumExecutor;
    }

    /**
     * Publishes every album and waits for all of them.
     * Outcomes are reported in the order the albums were given.
     */
    public PublishReport publishAll(List<AlbumSource> albums) throws InterruptedException {
        log.info("Publishing {} albums", albums.size());

        CompletionService<IndexedOutcome> completions = new ExecutorCompletionService<>(albumExecutor);
        for (int i = 0; i < albums.size(); i++) {
            int index = i;
            AlbumSource album = albums.get(i);
            completions.submit(() -> new IndexedOutcome(index, publish(album)));
        }

        AlbumOutcome[] outcomes = new AlbumOutcome[albums.size()];
        for (int remaining = albums.size(); remaining > 0; remaining--) {
            try {
                IndexedOutcome outcome = completions.take().get();
                outcomes[outcome.index()] = outcome.outcome();
            } catch (ExecutionException e) {
                // publish catches every RuntimeException; only an Error gets here
                throw new IllegalStateException("Album task failed", e.getCause());
            }
        }

        PublishReport report = new PublishReport(List.of(outcomes));
        log.info("Published {} albums, {} failed", report.publishedCount(), report.failedCount());
        return report;
    }

    /**
     * Derives and writes a single album, converting every failure into a failed outcome.
     */
    public AlbumOutcome publish(AlbumSource album) {
        try {
            AlbumManifest manifest = albumDerivationService.deriveAlbum(
                    album, publishingProperties.albumOutputDir(album.slug()));
            Path manifestFile = manifestWriter.write(manifest);
            log.info("Wrote manifest for {} to {}", album.slug(), manifestFile);

            eventPublisher.publishEvent(new AlbumPublished(
                    album.slug(),
                    manifest.images().size(),
                    manifest.failures().size(),
                    manifest.failedRenditionCount(),
                    Instant.now()));
            return AlbumOutcome.published(album, manifest, manifestFile);

        } catch (ProcessingException e) {
            log.error("Error processing album {}: {}", album.slug(), e.getMessage(), e);
            return fail(album, e.getKind(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while processing album {}", album.slug());
            return fail(album, ProcessingErrorKind.INTERNAL, "Interrupted");
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing album {}", album.slug(), e);
            return fail(album, ProcessingErrorKind.INTERNAL, String.valueOf(e.getMessage()));
        }
    }

    private AlbumOutcome fail(AlbumSource album, ProcessingErrorKind kind, String message) {
        eventPublisher.publishEvent(new AlbumFailed(album.slug(), kind, message, Instant.now()));
        return AlbumOutcome.failed(album, kind, message);
    }

    private record IndexedOutcome(int index, AlbumOutcome outcome) {
    }
}
