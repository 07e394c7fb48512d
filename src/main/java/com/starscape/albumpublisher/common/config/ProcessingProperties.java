package com.starscape.albumpublisher.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for rendition derivation.
 * Binds to app.processing.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {

    /**
     * How an existing rendition file is judged reusable.
     */
    public enum CachePolicy {
        /** Reuse any existing destination file. */
        EXISTENCE,
        /** Reuse an existing destination file unless its sidecar fingerprint disagrees. */
        FINGERPRINT
    }

    private Map<String, Integer> renditionWidths = defaultWidths();
    private Map<Integer, Integer> qualityByWidth = defaultQualities();
    private int defaultQuality = 80;
    private String coverFileName = "cover.jpg";
    private CachePolicy cachePolicy = CachePolicy.FINGERPRINT;
    private String captureZone;
    private int maxParallelFiles;
    private int maxParallelAlbums;

    public Map<String, Integer> getRenditionWidths() {
        return renditionWidths;
    }

    public void setRenditionWidths(Map<String, Integer> renditionWidths) {
        this.renditionWidths = renditionWidths;
    }

    public Map<Integer, Integer> getQualityByWidth() {
        return qualityByWidth;
    }

    public void setQualityByWidth(Map<Integer, Integer> qualityByWidth) {
        this.qualityByWidth = qualityByWidth;
    }

    public int getDefaultQuality() {
        return defaultQuality;
    }

    public void setDefaultQuality(int defaultQuality) {
        this.defaultQuality = defaultQuality;
    }

    public String getCoverFileName() {
        return coverFileName;
    }

    public void setCoverFileName(String coverFileName) {
        this.coverFileName = coverFileName;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    public void setCachePolicy(CachePolicy cachePolicy) {
        this.cachePolicy = cachePolicy;
    }

    public String getCaptureZone() {
        return captureZone;
    }

    public void setCaptureZone(String captureZone) {
        this.captureZone = captureZone;
    }

    public int getMaxParallelFiles() {
        return maxParallelFiles;
    }

    public void setMaxParallelFiles(int maxParallelFiles) {
        this.maxParallelFiles = maxParallelFiles;
    }

    public int getMaxParallelAlbums() {
        return maxParallelAlbums;
    }

    public void setMaxParallelAlbums(int maxParallelAlbums) {
        this.maxParallelAlbums = maxParallelAlbums;
    }

    /**
     * Width configured for a rendition label.
     * @throws IllegalStateException if the label has no configured width
     */
    public int widthFor(String label) {
        Integer width = renditionWidths.get(label);
        if (width == null || width <= 0) {
            throw new IllegalStateException("No positive width configured for rendition '" + label + "'");
        }
        return width;
    }

    /**
     * JPEG quality (1-100) for a target width, falling back to the default quality.
     */
    public int qualityFor(int width) {
        return qualityByWidth.getOrDefault(width, defaultQuality);
    }

    /**
     * Zone used to interpret EXIF timestamps, which carry no offset of their own.
     */
    public ZoneId captureZoneId() {
        if (captureZone == null || captureZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(captureZone.trim());
    }

    private static Map<String, Integer> defaultWidths() {
        Map<String, Integer> widths = new LinkedHashMap<>();
        widths.put("small", 600);
        widths.put("medium", 800);
        widths.put("large", 1536);
        return widths;
    }

    private static Map<Integer, Integer> defaultQualities() {
        Map<Integer, Integer> qualities = new LinkedHashMap<>();
        qualities.put(600, 80);
        qualities.put(800, 80);
        qualities.put(1536, 80);
        return qualities;
    }
}
