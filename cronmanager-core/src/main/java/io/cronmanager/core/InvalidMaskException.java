package io.cronmanager.core;

/**
 * Thrown when a cron mask cannot be parsed or produces no future fire time.
 */
public class InvalidMaskException extends IllegalArgumentException {

    private final String mask;

    public InvalidMaskException(String mask, String message) {
        super(message);
        this.mask = mask;
    }

    public InvalidMaskException(String mask, String message, Throwable cause) {
        super(message, cause);
        this.mask = mask;
    }

    /**
     * The rejected mask as supplied by the caller (may be null).
     */
    public String getMask() {
        return mask;
    }
}
