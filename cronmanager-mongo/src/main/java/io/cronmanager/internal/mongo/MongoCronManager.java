package io.cronmanager.internal.mongo;

import io.cronmanager.CronManager;
import io.cronmanager.config.CronManagerProperties;
import io.cronmanager.core.DuplicateNameException;
import io.cronmanager.core.Frequency;
import io.cronmanager.core.FrequencyInUseException;
import io.cronmanager.core.FrequencyValidator;
import io.cronmanager.core.Job;
import io.cronmanager.core.JobDefinition;
import io.cronmanager.core.JobScheduler;
import io.cronmanager.core.JobTargetRegistry;
import io.cronmanager.core.MaskValidation;
import io.cronmanager.core.TargetType;
import io.cronmanager.utils.Timezones;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mongo-backed {@link CronManager}.
 *
 * <p>Every operation reads the current time once from the injected {@link Clock} and hands it to
 * {@link JobScheduler} / {@link FrequencyValidator}. The only cross-process synchronization is the
 * conditional update in {@link MongoJobStore#claim(Job, Instant)}.
 *
 * <p>Typical runner loop (outside this library):
 * <pre>{@code
 * for (Job job : cronManager.findDueJobs()) {
 *     if (!cronManager.markRunning(job)) {
 *         continue; // claimed by another runner
 *     }
 *     boolean ok = execute(job);
 *     cronManager.completeRun(job.getId(), ok, elapsedSeconds);
 * }
 * }</pre>
 */
public class MongoCronManager implements CronManager {
    private static final Logger log = LoggerFactory.getLogger(MongoCronManager.class);

    private final MongoJobStore jobStore;
    private final MongoFrequencyStore frequencyStore;
    private final JobScheduler scheduler;
    private final FrequencyValidator validator;
    private final JobTargetRegistry targetRegistry;
    private final Clock clock;
    private final ZoneId previewZone;

    public MongoCronManager(CronManagerProperties props,
                            MongoJobStore jobStore,
                            MongoFrequencyStore frequencyStore,
                            JobScheduler scheduler,
                            FrequencyValidator validator,
                            JobTargetRegistry targetRegistry,
                            Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.frequencyStore = Objects.requireNonNull(frequencyStore, "frequencyStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.targetRegistry = Objects.requireNonNull(targetRegistry, "targetRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.previewZone = Timezones.parse(props.getDefaultTimezone());
    }

    @Override
    public Frequency createFrequency(String name, String mask) {
        requireText(name, "name");
        Instant now = now();

        validator.validate(mask, now, previewZone);
        validator.ensureUnique(mask, frequencyStore.findMasks(null));
        ensureFrequencyNameFree(name.trim(), null);

        Frequency saved = frequencyStore.save(Frequency.ofNew(name.trim(), mask));
        log.info("Frequency created name={} mask={} id={}", saved.name(), saved.mask(), saved.id());
        return saved;
    }

    @Override
    public Frequency updateFrequency(String id, String name, String mask) {
        requireText(name, "name");
        Frequency existing = requireFrequency(id);
        Instant now = now();

        validator.validate(mask, now, previewZone);
        validator.ensureUnique(mask, frequencyStore.findMasks(id));
        ensureFrequencyNameFree(name.trim(), id);

        Frequency saved = frequencyStore.save(new Frequency(id, name.trim(), mask));
        log.info("Frequency updated name={} mask={} id={}", saved.name(), saved.mask(), saved.id());

        if (!saved.mask().equals(existing.mask())) {
            int rescheduled = 0;
            for (Job job : jobStore.findByFrequencyId(id)) {
                job.setFrequency(saved);
                if (scheduler.reschedule(job, now)) {
                    jobStore.save(job);
                    rescheduled++;
                }
            }
            log.info("Mask changed for frequency id={}, rescheduled {} job(s)", id, rescheduled);
        }
        return saved;
    }

    @Override
    public void deleteFrequency(String id) {
        Objects.requireNonNull(id, "id must not be null");

        long referencing = jobStore.countByFrequencyId(id);
        if (referencing > 0) {
            throw new FrequencyInUseException(id, referencing);
        }
        if (frequencyStore.deleteById(id) == 0) {
            throw new IllegalArgumentException("No frequency found for id: " + id);
        }
        log.info("Frequency deleted id={}", id);
    }

    @Override
    public List<Frequency> listFrequencies() {
        return frequencyStore.findAll();
    }

    @Override
    public MaskValidation checkMask(String mask) {
        return validator.check(mask, frequencyStore.findMasks(null), now(), previewZone);
    }

    @Override
    public Job createJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");

        Frequency frequency = requireFrequency(definition.frequencyId());
        validateTarget(definition);
        if (jobStore.findByName(definition.name()).isPresent()) {
            throw new DuplicateNameException(definition.name());
        }

        Job job = Job.from(definition, frequency);
        scheduler.setEnabled(job, definition.enabled(), now());

        Job saved = jobStore.save(job);
        log.info("Cron job created name={} id={} enabled={} nextRunDate={}",
                saved.getName(), saved.getId(), saved.isEnabled(), saved.getNextRunDate());
        return saved;
    }

    @Override
    public Job updateJob(String id, JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");

        Job job = requireJob(id);
        Frequency frequency = requireFrequency(definition.frequencyId());
        validateTarget(definition);
        Optional<Job> sameName = jobStore.findByName(definition.name());
        if (sameName.isPresent() && !sameName.get().getId().equals(id)) {
            throw new DuplicateNameException(definition.name());
        }

        job.apply(definition, frequency);
        if (definition.enabled() && job.isRunning()) {
            // re-armed by completeRun
            job.setEnabled(true);
        } else {
            scheduler.setEnabled(job, definition.enabled(), now());
        }

        Job saved = jobStore.save(job);
        log.info("Cron job updated name={} id={} enabled={} nextRunDate={}",
                saved.getName(), saved.getId(), saved.isEnabled(), saved.getNextRunDate());
        return saved;
    }

    @Override
    public Job setEnabled(String id, boolean enabled) {
        Job job = requireJob(id);
        if (enabled && job.isEnabled() && job.isRunning()) {
            return job;
        }

        scheduler.setEnabled(job, enabled, now());
        Job saved = jobStore.save(job);
        log.info("Cron job {} name={} id={} nextRunDate={}",
                enabled ? "enabled" : "disabled", saved.getName(), saved.getId(), saved.getNextRunDate());
        return saved;
    }

    @Override
    public void deleteJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (jobStore.deleteById(id) == 0) {
            throw new IllegalArgumentException("No job found for id: " + id);
        }
        log.info("Cron job deleted id={}", id);
    }

    @Override
    public Optional<Job> findJob(String id) {
        return jobStore.findById(id);
    }

    @Override
    public List<Job> listJobs() {
        return jobStore.findAll();
    }

    @Override
    public List<Job> findDueJobs() {
        Instant now = now();
        List<Job> due = jobStore.findDueCandidates(now).stream()
                .filter(job -> scheduler.shouldRunNow(job, now))
                .toList();
        log.debug("Due cron jobs at {}: {}", now, due.size());
        return due;
    }

    @Override
    public boolean markRunning(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Instant now = now();

        if (!jobStore.claim(job, now)) {
            log.debug("Cron job already claimed name={} id={}", job.getName(), job.getId());
            return false;
        }
        if (job.isRunning()) {
            log.warn("Cron job exceeded its timeout, running again name={} id={} lastRunDate={} timeout={}s",
                    job.getName(), job.getId(), job.getLastRunDate(), job.getTimeout());
        }
        scheduler.markRunning(job, now);
        log.debug("Cron job running name={} id={}", job.getName(), job.getId());
        return true;
    }

    @Override
    public Job completeRun(String id, boolean success, double elapsedSeconds) {
        Job job = requireJob(id);
        if (!job.isRunning()) {
            log.warn("Ignoring run completion for a job that is not running name={} id={} status={}",
                    job.getName(), job.getId(), job.getStatus());
            return job;
        }

        scheduler.onRunCompleted(job, now(), success, elapsedSeconds);
        Job saved = jobStore.save(job);
        log.info("Cron job run completed name={} id={} success={} elapsed={}s nextRunDate={}",
                saved.getName(), saved.getId(), success, elapsedSeconds, saved.getNextRunDate());
        return saved;
    }

    @Override
    public List<String> listTimezones() {
        return Timezones.list();
    }

    @Override
    public void validateClassTarget(String name) {
        targetRegistry.validate(name);
    }

    private void validateTarget(JobDefinition definition) {
        if (definition.targetType() == TargetType.CLASS) {
            targetRegistry.validate(definition.target());
        }
    }

    private void ensureFrequencyNameFree(String name, String ownId) {
        Optional<Frequency> sameName = frequencyStore.findByName(name);
        if (sameName.isPresent() && !sameName.get().id().equals(ownId)) {
            throw MongoFrequencyStore.duplicateName(name);
        }
    }

    private Job requireJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("No job found for id: " + id));
    }

    private Frequency requireFrequency(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return frequencyStore.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("No frequency found for id: " + id));
    }

    // Mongo stores millisecond precision; keep in-memory instants comparable with stored ones.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
