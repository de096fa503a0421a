package io.cronmanager.core;

public class InvalidTargetException extends IllegalArgumentException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
