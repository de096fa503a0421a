package io.cronmanager.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A scheduled cron job.
 *
 * <p>Scheduling state ({@code status}, {@code nextRunDate}, {@code lastRunDate}) is owned by
 * {@link JobScheduler}; {@code stats} is updated through {@link RunStatsAggregator}.
 * Invariant kept by the scheduler: {@code status == INACTIVE} iff {@code enabled == false}.
 */
public class Job {

    private String id;
    private String name;
    private String description;

    private Frequency frequency;
    private String timezone;
    private boolean enabled;

    private TargetType targetType;
    private String target;
    private int timeout;

    private JobStatus status = JobStatus.INACTIVE;
    private Instant lastRunDate;
    private Instant nextRunDate;

    private RunStats stats = RunStats.empty();

    public Job() {
    }

    public static Job from(JobDefinition definition, Frequency frequency) {
        Objects.requireNonNull(definition, "definition must not be null");
        Job job = new Job();
        job.apply(definition, frequency);
        return job;
    }

    /**
     * Copies operator-editable fields. Does not touch {@code enabled}; callers go through
     * {@link JobScheduler#setEnabled(Job, boolean, Instant)} so the schedule is recomputed.
     */
    public void apply(JobDefinition definition, Frequency frequency) {
        setName(definition.name());
        setDescription(definition.description());
        setFrequency(frequency);
        setTimezone(definition.timezone());
        setTargetType(definition.targetType());
        setTarget(definition.target());
        setTimeout(definition.timeout());
    }

    public boolean isInactive() {
        return status == JobStatus.INACTIVE;
    }

    public boolean isScheduled() {
        return status == JobStatus.SCHEDULED;
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public void setFrequency(Frequency frequency) {
        this.frequency = frequency;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public void setTargetType(TargetType targetType) {
        this.targetType = targetType;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target == null ? null : target.trim();
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.timeout = timeout;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public Instant getLastRunDate() {
        return lastRunDate;
    }

    public void setLastRunDate(Instant lastRunDate) {
        this.lastRunDate = lastRunDate;
    }

    public Instant getNextRunDate() {
        return nextRunDate;
    }

    public void setNextRunDate(Instant nextRunDate) {
        this.nextRunDate = nextRunDate;
    }

    public RunStats getStats() {
        return stats;
    }

    public void setStats(RunStats stats) {
        this.stats = stats == null ? RunStats.empty() : stats;
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", status=" + status +
                ", enabled=" + enabled +
                ", nextRunDate=" + nextRunDate +
                '}';
    }
}
