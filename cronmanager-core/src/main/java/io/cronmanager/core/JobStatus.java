package io.cronmanager.core;

public enum JobStatus {
    INACTIVE,
    SCHEDULED,
    RUNNING
}
