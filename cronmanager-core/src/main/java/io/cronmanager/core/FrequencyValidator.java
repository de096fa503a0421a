package io.cronmanager.core;

import io.cronmanager.utils.CronExpressionEvaluator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Objects;

/**
 * Validates cron masks before they are stored and previews their next fire times.
 */
public class FrequencyValidator {

    public static final String INVALID_MASK_MESSAGE = "Invalid cron job pattern";
    public static final String DUPLICATE_MASK_MESSAGE = "A frequency with this mask already exists!";

    /**
     * Parse {@code mask} and compute its next two fire times after {@code now}.
     *
     * @throws InvalidMaskException if the mask is malformed or its fire times cannot be computed
     */
    public FrequencyPreview validate(String mask, Instant now, ZoneId zone) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (mask == null) {
            throw new InvalidMaskException(null, INVALID_MASK_MESSAGE);
        }

        String trimmed = mask.trim();
        try {
            Instant first = CronExpressionEvaluator.nextFireTime(trimmed, now, 0, zone);
            Instant second = CronExpressionEvaluator.nextFireTime(trimmed, now, 1, zone);
            return new FrequencyPreview(first, second, zone);
        } catch (InvalidMaskException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidMaskException(mask, INVALID_MASK_MESSAGE, e);
        }
    }

    /**
     * @throws DuplicateMaskException if one of {@code existingMasks} is exactly {@code mask}
     */
    public void ensureUnique(String mask, Collection<String> existingMasks) {
        Objects.requireNonNull(mask, "mask must not be null");
        Objects.requireNonNull(existingMasks, "existingMasks must not be null");

        String trimmed = mask.trim();
        if (existingMasks.contains(trimmed)) {
            throw new DuplicateMaskException(trimmed);
        }
    }

    /**
     * On-demand check from an editing surface. Never throws for a bad mask; the reason is
     * returned in {@link MaskValidation#message()}.
     */
    public MaskValidation check(String mask, Collection<String> existingMasks, Instant now, ZoneId zone) {
        FrequencyPreview preview;
        try {
            preview = validate(mask, now, zone);
        } catch (InvalidMaskException e) {
            return MaskValidation.invalid(INVALID_MASK_MESSAGE);
        }

        try {
            ensureUnique(mask, existingMasks);
        } catch (DuplicateMaskException e) {
            return MaskValidation.invalid(DUPLICATE_MASK_MESSAGE);
        }
        return MaskValidation.valid(preview);
    }
}
