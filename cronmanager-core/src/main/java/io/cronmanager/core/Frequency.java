package io.cronmanager.core;

import java.util.Objects;

/**
 * A named cron mask that jobs reference for their schedule.
 */
public record Frequency(
        String id,
        String name,
        String mask
) {
    public Frequency {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(mask, "mask must not be null");
        mask = mask.trim();
    }

    public static Frequency ofNew(String name, String mask) {
        return new Frequency(null, name, mask);
    }

    public Frequency withId(String id) {
        return new Frequency(id, name, mask);
    }
}
