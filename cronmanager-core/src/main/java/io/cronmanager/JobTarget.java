package io.cronmanager;

import io.cronmanager.core.Job;

/**
 * In-process target of a {@link io.cronmanager.core.TargetType#CLASS} job.
 * Implementations are registered by name in a {@link io.cronmanager.core.JobTargetRegistry}.
 */
public interface JobTarget {
    String name();

    void run(Job job) throws Exception;
}
