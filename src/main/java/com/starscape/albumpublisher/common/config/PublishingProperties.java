package com.starscape.albumpublisher.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Filesystem layout of the static site being published.
 * Binds to app.publishing.* properties from application.yml
 *
 * The static, data and content roots default to the conventional Hugo
 * directories beneath {@code site-root} when not set explicitly.
 */
@ConfigurationProperties(prefix = "app.publishing")
public class PublishingProperties {

    private Path siteRoot = Path.of(".");
    private Path staticRoot;
    private Path dataRoot;
    private Path contentRoot;
    private String section = "album";
    private boolean runOnStartup = true;

    public Path getSiteRoot() {
        return siteRoot;
    }

    public void setSiteRoot(Path siteRoot) {
        this.siteRoot = siteRoot;
    }

    public Path getStaticRoot() {
        return staticRoot != null ? staticRoot : siteRoot.resolve("static");
    }

    public void setStaticRoot(Path staticRoot) {
        this.staticRoot = staticRoot;
    }

    public Path getDataRoot() {
        return dataRoot != null ? dataRoot : siteRoot.resolve("data");
    }

    public void setDataRoot(Path dataRoot) {
        this.dataRoot = dataRoot;
    }

    public Path getContentRoot() {
        return contentRoot != null ? contentRoot : siteRoot.resolve("content");
    }

    public void setContentRoot(Path contentRoot) {
        this.contentRoot = contentRoot;
    }

    public String getSection() {
        return section;
    }

    public void setSection(String section) {
        this.section = section;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    /** Directory the renditions of an album are written to. */
    public Path albumOutputDir(String slug) {
        return getStaticRoot().resolve(section).resolve(slug);
    }

    /** Directory the manifest of an album is written to. */
    public Path manifestDir(String slug) {
        return getDataRoot().resolve(section).resolve(slug);
    }

    /** Directory holding the album content pages whose front matter names source directories. */
    public Path albumContentDir() {
        return getContentRoot().resolve(section);
    }

    /**
     * URL of a file below the static root, relative to that root, always '/'-separated.
     */
    public String relativeUrl(Path file) {
        Path relative = getStaticRoot().toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize());
        StringBuilder url = new StringBuilder();
        for (Path part : relative) {
            if (url.length() > 0) {
                url.append('/');
            }
            url.append(part);
        }
        return url.toString();
    }
}
