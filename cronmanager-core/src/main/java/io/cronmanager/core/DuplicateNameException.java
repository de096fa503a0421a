package io.cronmanager.core;

public class DuplicateNameException extends IllegalStateException {

    private final String name;

    public DuplicateNameException(String name) {
        this(name, "This cron job already exists: " + name);
    }

    public DuplicateNameException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
