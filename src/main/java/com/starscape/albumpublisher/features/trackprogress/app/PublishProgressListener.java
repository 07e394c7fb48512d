package com.starscape.albumpublisher.features.trackprogress.app;

import com.starscape.albumpublisher.features.publish.domain.events.AlbumFailed;
import com.starscape.albumpublisher.features.publish.domain.events.AlbumPublished;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs album completion events and keeps running totals for the process.
 * Events arrive on album worker threads, hence the atomic counters.
 */
@Component
public class PublishProgressListener {

    private static final Logger log = LoggerFactory.getLogger(PublishProgressListener.class);

    private final AtomicInteger publishedAlbums = new AtomicInteger();
    private final AtomicInteger failedAlbums = new AtomicInteger();
    private final AtomicLong publishedImages = new AtomicLong();

    @EventListener
    public void onAlbumPublished(AlbumPublished event) {
        int albums = publishedAlbums.incrementAndGet();
        long images = publishedImages.addAndGet(event.imageCount());
        if (event.failedFileCount() > 0 || event.failedRenditionCount() > 0) {
            log.warn("Album {} published with problems: images={}, failedFiles={}, failedRenditions={}",
                    event.slug(), event.imageCount(), event.failedFileCount(), event.failedRenditionCount());
        } else {
            log.info("Album {} published: images={}", event.slug(), event.imageCount());
        }
        log.debug("Progress: albums={}, images={}, failedAlbums={}", albums, images, failedAlbums.get());
    }

    @EventListener
    public void onAlbumFailed(AlbumFailed event) {
        failedAlbums.incrementAndGet();
        log.error("Album {} failed ({}): {}", event.slug(), event.errorKind(), event.errorMessage());
    }

    public int getPublishedAlbums() {
        return publishedAlbums.get();
    }

    public int getFailedAlbums() {
        return failedAlbums.get();
    }

    public long getPublishedImages() {
        return publishedImages.get();
    }
}
