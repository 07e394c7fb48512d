package com.starscape.albumpublisher.features.publish.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.starscape.albumpublisher.common.config.PublishingProperties;
import com.starscape.albumpublisher.features.derive.domain.AlbumSource;
import com.starscape.albumpublisher.features.publish.domain.AlbumFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds albums from the content pages of the site's album section.
 *
 * Each page whose front matter has an {@code album} key becomes an album; the
 * slug is the page's file name without extension and the key's value names
 * the source directory (resolved against the site root when relative).
 * Front matter may be TOML ({@code +++}), YAML ({@code ---}) or JSON.
 */
@Component
public class FrontMatterAlbumFinder implements AlbumFinder {

    private static final Logger log = LoggerFactory.getLogger(FrontMatterAlbumFinder.class);

    static final String ALBUM_KEY = "album";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final PublishingProperties publishingProperties;
    private final TomlMapper tomlMapper = new TomlMapper();
    private final YAMLMapper yamlMapper = new YAMLMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public FrontMatterAlbumFinder(PublishingProperties publishingProperties) {
        this.publishingProperties = publishingProperties;
    }

    @Override
    public List<AlbumSource> findAlbums() {
        Path contentDir = publishingProperties.albumContentDir();
        if (!Files.isDirectory(contentDir)) {
            log.warn("Album content directory {} not found", contentDir);
            return List.of();
        }

        List<Path> pages;
        try (Stream<Path> entries = Files.list(contentDir)) {
            pages = entries
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.error("Cannot list album content directory {}", contentDir, e);
            return List.of();
        }

        List<AlbumSource> albums = new ArrayList<>();
        for (Path page : pages) {
            toAlbum(page).ifPresent(albums::add);
        }
        log.info("Found {} albums in {}", albums.size(), contentDir);
        return albums;
    }

    private Optional<AlbumSource> toAlbum(Path page) {
        String slug = slugOf(page);
        log.debug("Extracted slug {}", slug);

        Map<String, Object> frontMatter;
        try {
            frontMatter = parseFrontMatter(Files.readString(page, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Skipping {}: cannot read front matter: {}", page, e.getMessage());
            return Optional.empty();
        }

        if (!(frontMatter.get(ALBUM_KEY) instanceof String dir) || dir.isBlank()) {
            log.info("No album front matter setting in {}", page.getFileName());
            return Optional.empty();
        }
        Path sourceDir = publishingProperties.getSiteRoot().resolve(dir.trim());
        return Optional.of(new AlbumSource(slug, sourceDir));
    }

    static String slugOf(Path page) {
        String fileName = page.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Parses the front matter block at the start of a content page.
     * A page without front matter yields an empty map.
     *
     * @throws JsonProcessingException if the block is not valid for its format
     */
    Map<String, Object> parseFrontMatter(String content) throws JsonProcessingException {
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        if (text.startsWith("+++")) {
            String block = fencedBlock(text, "+++");
            return block.isBlank() ? Map.of() : tomlMapper.readValue(block, MAP_TYPE);
        }
        if (text.startsWith("---")) {
            String block = fencedBlock(text, "---");
            Map<String, Object> values = block.isBlank() ? null : yamlMapper.readValue(block, MAP_TYPE);
            return values != null ? values : Map.of();
        }
        if (text.stripLeading().startsWith("{")) {
            return jsonMapper.readValue(text, MAP_TYPE);
        }
        return Map.of();
    }

    private static String fencedBlock(String text, String fence) throws JsonProcessingException {
        String[] lines = text.split("\\R", -1);
        StringBuilder block = new StringBuilder();
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].trim().equals(fence)) {
                return block.toString();
            }
            block.append(lines[i]).append('\n');
        }
        throw new FrontMatterException("Unterminated front matter, missing closing " + fence);
    }

    static class FrontMatterException extends JsonProcessingException {

        FrontMatterException(String message) {
            super(message);
        }
    }
}
