package io.cronmanager.internal.mongo;

import io.cronmanager.core.JobStatus;
import io.cronmanager.core.TargetType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for persisted cron jobs.
 */
@Document(collection = JobDocument.COLLECTION)
public class JobDocument {

    public static final String COLLECTION = "cron_manager_jobs";

    @Id
    private String id;

    private String name;
    private String description;
    private String frequencyId;
    private String timezone;
    private boolean enabled;

    private TargetType targetType;
    private String target;
    private int timeout;

    private JobStatus status;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunDate;

    @Field(write = Field.Write.ALWAYS)
    private Instant lastRunDate;

    private Map<String, Object> stats;

    public JobDocument() {
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

    public String getFrequencyId() {
        return frequencyId;
    }

    public void setFrequencyId(String frequencyId) {
        this.frequencyId = frequencyId;
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
        this.target = target;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getNextRunDate() {
        return nextRunDate;
    }

    public void setNextRunDate(Instant nextRunDate) {
        this.nextRunDate = nextRunDate;
    }

    public Instant getLastRunDate() {
        return lastRunDate;
    }

    public void setLastRunDate(Instant lastRunDate) {
        this.lastRunDate = lastRunDate;
    }

    public Map<String, Object> getStats() {
        return stats;
    }

    public void setStats(Map<String, Object> stats) {
        this.stats = stats;
    }
}
