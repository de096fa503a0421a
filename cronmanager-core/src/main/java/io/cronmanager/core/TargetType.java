package io.cronmanager.core;

/**
 * What a job invokes when it fires.
 */
public enum TargetType {
    /**
     * HTTP GET to a URL; {@code {placeholders}} are substituted by the executor.
     */
    URL,
    /**
     * A named {@link io.cronmanager.JobTarget} registered in the {@link JobTargetRegistry}.
     */
    CLASS
}
