package com.starscape.albumpublisher.features.derive.app;

import com.starscape.albumpublisher.features.derive.domain.ImageRecord;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Manifest order: ascending capture time, undated images last.
 * {@link List#sort} is stable, so ties keep their encounter order.
 */
public final class CaptureTimeOrdering {

    public static final Comparator<ImageRecord> BY_CAPTURE_TIME = Comparator.comparing(
            CaptureTimeOrdering::captureInstant,
            Comparator.nullsLast(Comparator.naturalOrder()));

    private CaptureTimeOrdering() {
    }

    public static List<ImageRecord> sort(List<ImageRecord> records) {
        List<ImageRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_CAPTURE_TIME);
        return sorted;
    }

    private static Instant captureInstant(ImageRecord record) {
        ZonedDateTime captureTime = record.metadata().captureTime();
        return captureTime != null ? captureTime.toInstant() : null;
    }
}
