package io.cronmanager.utils;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

/**
 * Time zone names as operators see them.
 * <p>
 * Jobs store IANA ids; the admin surface shows them with spaces instead of underscores
 * (e.g. "America/New York"). Both forms are accepted.
 */
public final class Timezones {
    // continent and ocean regions; legacy aliases (US/, Etc/, SystemV/, ...) are left out
    private static final Set<String> REGIONS = Set.of(
            "Africa", "America", "Antarctica", "Arctic", "Asia",
            "Atlantic", "Australia", "Europe", "Indian", "Pacific");

    private Timezones() {
    }

    /**
     * @throws IllegalArgumentException if the name is blank or not a known zone
     */
    public static ZoneId parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("timezone must not be blank");
        }
        try {
            return ZoneId.of(name.trim().replace(' ', '_'));
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid timezone: " + name, ex);
        }
    }

    /**
     * Canonical region zone ids plus UTC in display form, sorted.
     */
    public static List<String> list() {
        return ZoneId.getAvailableZoneIds().stream()
                .filter(id -> "UTC".equals(id) || isRegion(id))
                .sorted()
                .map(id -> id.replace('_', ' '))
                .toList();
    }

    private static boolean isRegion(String id) {
        int slash = id.indexOf('/');
        return slash > 0 && REGIONS.contains(id.substring(0, slash));
    }
}
