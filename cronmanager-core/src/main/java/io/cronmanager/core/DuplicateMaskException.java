package io.cronmanager.core;

public class DuplicateMaskException extends IllegalStateException {

    private final String mask;

    public DuplicateMaskException(String mask) {
        super("A frequency with this mask already exists: " + mask);
        this.mask = mask;
    }

    public String getMask() {
        return mask;
    }
}
