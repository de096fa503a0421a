package io.cronmanager.core;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * The next two fire times of a mask, shown to an operator before the mask is saved.
 */
public record FrequencyPreview(
        Instant first,
        Instant second,
        ZoneId zone
) {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:00");

    public FrequencyPreview {
        first = first.truncatedTo(ChronoUnit.MINUTES);
        second = second.truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * Human-readable interval, e.g. {@code (2026-01-01 12:05:00, 2026-01-01 12:10:00)}.
     */
    public String formatted() {
        return "(" + FORMAT.format(first.atZone(zone)) + ", " + FORMAT.format(second.atZone(zone)) + ")";
    }
}
