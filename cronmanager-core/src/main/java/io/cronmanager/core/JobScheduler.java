package io.cronmanager.core;

import io.cronmanager.utils.CronExpressionEvaluator;
import io.cronmanager.utils.Timezones;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Owns the per-job state machine {@code INACTIVE | SCHEDULED | RUNNING}.
 *
 * <p>All methods take the current time as a parameter and never read a clock. Apart from
 * {@link #shouldRunNow(Job, Instant)}, which is read-only, they mutate the passed {@link Job};
 * persisting it is up to the caller.
 */
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    /**
     * A freshly computed next run date is always more than this far in the future.
     */
    public static final Duration MINIMUM_LEAD_TIME = Duration.ofSeconds(60);

    /**
     * Enable or disable a job. Enabling always recomputes {@code nextRunDate} as of {@code now}.
     *
     * @throws IllegalStateException if enabling a job without a frequency
     * @throws InvalidMaskException  if enabling a job whose mask does not parse
     */
    public void setEnabled(Job job, boolean enabled, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (enabled) {
            Instant next = nextRunDate(job.getFrequency(), job.getTimezone(), now);
            job.setNextRunDate(next);
            job.setEnabled(true);
            job.setStatus(JobStatus.SCHEDULED);
            log.debug("Cron job scheduled name={} nextRunDate={}", job.getName(), next);
        } else {
            job.setEnabled(false);
            job.setStatus(JobStatus.INACTIVE);
            log.debug("Cron job disabled name={}", job.getName());
        }
    }

    /**
     * Next run date for a frequency, with at least {@link #MINIMUM_LEAD_TIME} between
     * {@code now} and the result. If the first fire time is too close, the one after it is used.
     */
    public Instant nextRunDate(Frequency frequency, String timezone, Instant now) {
        if (frequency == null) {
            throw new IllegalStateException("Cron job has no frequency");
        }
        ZoneId zone = Timezones.parse(timezone);

        Instant runDate = CronExpressionEvaluator.nextFireTime(frequency.mask(), now, 0, zone);
        if (Duration.between(now, runDate).compareTo(MINIMUM_LEAD_TIME) <= 0) {
            runDate = CronExpressionEvaluator.nextFireTime(frequency.mask(), now, 1, zone);
        }
        return runDate;
    }

    /**
     * Whether the runner should dispatch this job at {@code now}.
     * <ul>
     *   <li>disabled jobs never run</li>
     *   <li>a running job runs again only once {@code lastRunDate + timeout} has passed (hung job)</li>
     *   <li>a scheduled job runs once {@code now} is strictly after {@code nextRunDate}</li>
     * </ul>
     */
    public boolean shouldRunNow(Job job, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (!job.isEnabled()) {
            return false;
        }

        if (job.isRunning()) {
            Instant lastRun = job.getLastRunDate();
            if (lastRun == null) {
                return true;
            }
            return now.isAfter(lastRun.plusSeconds(job.getTimeout()));
        }

        Instant next = job.getNextRunDate();
        return next != null && now.isAfter(next);
    }

    /**
     * Moves a job into RUNNING at dispatch time.
     */
    public void markRunning(Job job, Instant startedAt) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");

        job.setStatus(JobStatus.RUNNING);
        job.setLastRunDate(startedAt);
    }

    /**
     * Records a finished run: folds the outcome into the stats and re-arms the job.
     * <p>
     * A job disabled while it was running stays INACTIVE. A job whose frequency is gone or whose
     * mask no longer parses is disabled instead of being left in RUNNING.
     */
    public void onRunCompleted(Job job, Instant now, boolean success, double elapsedSeconds) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(now, "now must not be null");

        job.setStats(RunStatsAggregator.fold(job.getStats(), success, elapsedSeconds));

        if (!job.isEnabled()) {
            job.setStatus(JobStatus.INACTIVE);
            return;
        }

        try {
            job.setNextRunDate(nextRunDate(job.getFrequency(), job.getTimezone(), now));
            job.setStatus(JobStatus.SCHEDULED);
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.warn("Cron job cannot be rescheduled, disabling name={} id={} msg={}",
                    job.getName(), job.getId(), e.getMessage());
            job.setEnabled(false);
            job.setStatus(JobStatus.INACTIVE);
        }
    }

    /**
     * Recomputes the next run date of a waiting job, e.g. after its frequency's mask was edited.
     * Running and disabled jobs are left alone; they pick up the new mask when they are re-armed.
     *
     * @return true if the job was rescheduled
     */
    public boolean reschedule(Job job, Instant now) {
        Objects.requireNonNull(job, "job must not be null");
        if (!job.isEnabled() || job.isRunning()) {
            return false;
        }
        job.setNextRunDate(nextRunDate(job.getFrequency(), job.getTimezone(), now));
        job.setStatus(JobStatus.SCHEDULED);
        return true;
    }
}
