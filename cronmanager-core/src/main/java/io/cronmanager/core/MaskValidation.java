package io.cronmanager.core;

/**
 * Result of an on-demand mask check from an editing surface.
 *
 * valid   : true if the mask parses and is not used by another frequency
 * message : preview text when valid, otherwise the reason it was rejected
 * preview : the computed fire times, null when invalid
 */
public record MaskValidation(
        boolean valid,
        String message,
        FrequencyPreview preview
) {

    public static MaskValidation valid(FrequencyPreview preview) {
        return new MaskValidation(true, preview.formatted(), preview);
    }

    public static MaskValidation invalid(String message) {
        return new MaskValidation(false, message, null);
    }
}
