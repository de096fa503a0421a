package io.cronmanager;

import io.cronmanager.core.Frequency;
import io.cronmanager.core.Job;
import io.cronmanager.core.JobDefinition;
import io.cronmanager.core.MaskValidation;

import java.util.List;
import java.util.Optional;

/**
 * Main cron manager API.
 *
 * <p>Covers two surfaces:
 * <ul>
 *   <li>Administration of frequencies (named cron masks) and jobs</li>
 *   <li>The runner contract: find due jobs, claim one, report its outcome</li>
 * </ul>
 *
 * <p>The runner itself (a periodic external trigger) and job execution live outside this API.
 */
public interface CronManager {

    Frequency createFrequency(String name, String mask);

    /**
     * Update a frequency. Enabled jobs waiting on the old mask are rescheduled.
     */
    Frequency updateFrequency(String id, String name, String mask);

    /**
     * Delete a frequency that no job references.
     *
     * @throws io.cronmanager.core.FrequencyInUseException if a job still references it
     */
    void deleteFrequency(String id);

    List<Frequency> listFrequencies();

    /**
     * Validate a mask without saving it; returns the next two fire times when valid.
     */
    MaskValidation checkMask(String mask);

    Job createJob(JobDefinition definition);

    Job updateJob(String id, JobDefinition definition);

    Job setEnabled(String id, boolean enabled);

    void deleteJob(String id);

    Optional<Job> findJob(String id);

    List<Job> listJobs();

    /**
     * Enabled jobs that should be dispatched at the current tick (including hung jobs).
     */
    List<Job> findDueJobs();

    /**
     * Atomically move a due job into RUNNING.
     *
     * @return false if the stored job changed since it was read (e.g. another runner claimed it)
     */
    boolean markRunning(Job job);

    /**
     * Fold a finished run into the job's stats and re-arm it.
     * Completions for a job that is not RUNNING are ignored and the stored job is returned unchanged.
     */
    Job completeRun(String id, boolean success, double elapsedSeconds);

    List<String> listTimezones();

    void validateClassTarget(String name);
}
