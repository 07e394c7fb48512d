package com.starscape.albumpublisher.features.publish.api;

import com.starscape.albumpublisher.features.derive.domain.AlbumSource;
import com.starscape.albumpublisher.features.publish.app.AlbumPublishingService;
import com.starscape.albumpublisher.features.publish.domain.AlbumFinder;
import com.starscape.albumpublisher.features.publish.domain.PublishReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 *   --source=DIR --slug=SLUG   publish a single directory
 *   --album=SLUG               publish only the named albums (repeatable)
 *   (no options)               publish every album found in the content section
 * </pre>
 *
 * Only enabled when app.publishing.run-on-startup is true (the default).
 */
@Component
@ConditionalOnProperty(name = "app.publishing.run-on-startup", havingValue = "true", matchIfMissing = true)
public class PublishCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PublishCommandRunner.class);

    static final String SOURCE_OPTION = "source";
    static final String SLUG_OPTION = "slug";
    static final String ALBUM_OPTION = "album";

    private final AlbumFinder albumFinder;
    private final AlbumPublishingService publishingService;

    private volatile int exitCode;

    public PublishCommandRunner(AlbumFinder albumFinder, AlbumPublishingService publishingService) {
        this.albumFinder = albumFinder;
        this.publishingService = publishingService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<AlbumSource> albums = selectAlbums(args);
        if (albums.isEmpty()) {
            log.warn("No albums to publish");
            return;
        }

        PublishReport report = publishingService.publishAll(albums);
        if (report.hasFailures()) {
            log.error("Run finished with failures: published={}, failed={}",
                    report.publishedCount(), report.failedCount());
            exitCode = 1;
        } else {
            log.info("Run finished: published={}", report.publishedCount());
            exitCode = 0;
        }
    }

    List<AlbumSource> selectAlbums(ApplicationArguments args) {
        if (args.containsOption(SOURCE_OPTION)) {
            String source = single(args, SOURCE_OPTION);
            String slug = args.containsOption(SLUG_OPTION)
                    ? single(args, SLUG_OPTION)
                    : Path.of(source).getFileName().toString();
            return List.of(new AlbumSource(slug, Path.of(source)));
        }

        List<AlbumSource> albums = albumFinder.findAlbums();
        if (!args.containsOption(ALBUM_OPTION)) {
            return albums;
        }
        Set<String> wanted = Set.copyOf(args.getOptionValues(ALBUM_OPTION));
        List<AlbumSource> selected = albums.stream()
                .filter(album -> wanted.contains(album.slug()))
                .toList();
        if (selected.size() < wanted.size()) {
            log.warn("Some requested albums were not found: requested={}, found={}",
                    wanted, selected.stream().map(AlbumSource::slug).toList());
        }
        return selected;
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Option --" + option + " needs exactly one value");
        }
        return values.get(0);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
