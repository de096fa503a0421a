package io.cronmanager.internal.mongo;

import io.cronmanager.JobTarget;
import io.cronmanager.config.CronManagerProperties;
import io.cronmanager.core.DuplicateMaskException;
import io.cronmanager.core.DuplicateNameException;
import io.cronmanager.core.Frequency;
import io.cronmanager.core.FrequencyInUseException;
import io.cronmanager.core.FrequencyValidator;
import io.cronmanager.core.InvalidMaskException;
import io.cronmanager.core.InvalidTargetException;
import io.cronmanager.core.Job;
import io.cronmanager.core.JobDefinition;
import io.cronmanager.core.JobScheduler;
import io.cronmanager.core.JobStatus;
import io.cronmanager.core.JobTargetRegistry;
import io.cronmanager.core.MaskValidation;
import io.cronmanager.core.RunStats;
import io.cronmanager.core.TargetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoCronManagerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Frequency EVERY_FIVE = new Frequency("f1", "every five minutes", "*/5 * * * *");

    @Mock
    private MongoJobStore jobStore;

    @Mock
    private MongoFrequencyStore frequencyStore;

    private MongoCronManager cronManager;

    @BeforeEach
    void setUp() {
        JobTarget cleanup = new JobTarget() {
            @Override
            public String name() {
                return "cleanup";
            }

            @Override
            public void run(Job job) {
            }
        };

        cronManager = new MongoCronManager(
                new CronManagerProperties(),
                jobStore,
                frequencyStore,
                new JobScheduler(),
                new FrequencyValidator(),
                new JobTargetRegistry(List.of(cleanup)),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void createFrequencyShouldValidateAndSave() {
        when(frequencyStore.findMasks(null)).thenReturn(List.of("0 * * * *"));
        when(frequencyStore.save(any(Frequency.class))).thenAnswer(inv -> inv.<Frequency>getArgument(0).withId("f9"));

        Frequency saved = cronManager.createFrequency(" every five ", " */5 * * * * ");

        assertEquals(new Frequency("f9", "every five", "*/5 * * * *"), saved);
    }

    @Test
    void createFrequencyShouldRejectInvalidMask() {
        assertThrows(InvalidMaskException.class, () -> cronManager.createFrequency("broken", "bogus"));

        verify(frequencyStore, never()).save(any());
    }

    @Test
    void createFrequencyShouldRejectDuplicateMask() {
        when(frequencyStore.findMasks(null)).thenReturn(List.of("*/5 * * * *"));

        assertThrows(DuplicateMaskException.class, () -> cronManager.createFrequency("again", "*/5 * * * *"));

        verify(frequencyStore, never()).save(any());
    }

    @Test
    void createFrequencyShouldRejectDuplicateName() {
        when(frequencyStore.findMasks(null)).thenReturn(List.of());
        when(frequencyStore.findByName("hourly")).thenReturn(Optional.of(new Frequency("f2", "hourly", "0 * * * *")));

        DuplicateNameException ex = assertThrows(DuplicateNameException.class,
                () -> cronManager.createFrequency(" hourly ", "30 * * * *"));

        assertEquals("hourly", ex.getName());
        verify(frequencyStore, never()).save(any());
    }

    @Test
    void updateFrequencyShouldRejectNameOfAnotherFrequency() {
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(frequencyStore.findMasks("f1")).thenReturn(List.of());
        when(frequencyStore.findByName("hourly")).thenReturn(Optional.of(new Frequency("f2", "hourly", "0 * * * *")));

        assertThrows(DuplicateNameException.class, () -> cronManager.updateFrequency("f1", "hourly", "30 * * * *"));

        verify(frequencyStore, never()).save(any());
    }

    @Test
    void updateFrequencyShouldKeepItsOwnName() {
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(frequencyStore.findMasks("f1")).thenReturn(List.of());
        when(frequencyStore.findByName("every five minutes")).thenReturn(Optional.of(EVERY_FIVE));
        when(frequencyStore.save(any(Frequency.class))).thenAnswer(inv -> inv.getArgument(0));

        Frequency saved = cronManager.updateFrequency("f1", "every five minutes", "*/10 * * * *");

        assertEquals(new Frequency("f1", "every five minutes", "*/10 * * * *"), saved);
    }

    @Test
    void checkMaskShouldPreviewInDefaultZone() {
        when(frequencyStore.findMasks(null)).thenReturn(List.of());

        MaskValidation result = cronManager.checkMask("*/5 * * * *");

        assertTrue(result.valid());
        assertEquals("(2026-01-01 12:05:00, 2026-01-01 12:10:00)", result.message());
    }

    @Test
    void updateFrequencyShouldRescheduleWaitingJobs() {
        Job waiting = scheduledJob("j1", EVERY_FIVE, Instant.parse("2026-01-01T12:05:00Z"));
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(frequencyStore.findMasks("f1")).thenReturn(List.of());
        when(frequencyStore.save(any(Frequency.class))).thenAnswer(inv -> inv.getArgument(0));
        when(jobStore.findByFrequencyId("f1")).thenReturn(List.of(waiting));

        cronManager.updateFrequency("f1", "hourly", "0 * * * *");

        assertEquals(Instant.parse("2026-01-01T13:00:00Z"), waiting.getNextRunDate());
        assertEquals("0 * * * *", waiting.getFrequency().mask());
        verify(jobStore).save(waiting);
    }

    @Test
    void updateFrequencyShouldFailForUnknownId() {
        when(frequencyStore.findById("nope")).thenReturn(Optional.empty());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> cronManager.updateFrequency("nope", "hourly", "0 * * * *"));

        assertEquals("No frequency found for id: nope", ex.getMessage());
    }

    @Test
    void deleteFrequencyShouldFailWhileReferenced() {
        when(jobStore.countByFrequencyId("f1")).thenReturn(2L);

        FrequencyInUseException ex = assertThrows(FrequencyInUseException.class,
                () -> cronManager.deleteFrequency("f1"));

        assertEquals(2L, ex.getReferencingJobs());
        verify(frequencyStore, never()).deleteById(any());
    }

    @Test
    void createJobShouldScheduleEnabledJob() {
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(jobStore.findByName("report")).thenReturn(Optional.empty());
        when(jobStore.save(any(Job.class))).thenAnswer(inv -> {
            Job job = inv.getArgument(0);
            job.setId("j1");
            return job;
        });

        Job job = cronManager.createJob(definition("report").enabled(true).build());

        assertEquals("j1", job.getId());
        assertTrue(job.isEnabled());
        assertEquals(JobStatus.SCHEDULED, job.getStatus());
        assertEquals(Instant.parse("2026-01-01T12:05:00Z"), job.getNextRunDate());
    }

    @Test
    void createJobShouldKeepDisabledJobInactive() {
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(jobStore.findByName("report")).thenReturn(Optional.empty());
        when(jobStore.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));

        Job job = cronManager.createJob(definition("report").build());

        assertFalse(job.isEnabled());
        assertEquals(JobStatus.INACTIVE, job.getStatus());
    }

    @Test
    void createJobShouldRejectDuplicateName() {
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(jobStore.findByName("report")).thenReturn(Optional.of(new Job()));

        assertThrows(DuplicateNameException.class, () -> cronManager.createJob(definition("report").build()));

        verify(jobStore, never()).save(any());
    }

    @Test
    void createJobShouldRejectUnknownClassTarget() {
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        JobDefinition definition = definition("purge").targetClass("com.example.Purge").build();

        assertThrows(InvalidTargetException.class, () -> cronManager.createJob(definition));

        verify(jobStore, never()).save(any());
    }

    @Test
    void updateJobShouldRejectNameOfAnotherJob() {
        Job existing = scheduledJob("j1", EVERY_FIVE, Instant.parse("2026-01-01T12:05:00Z"));
        Job other = scheduledJob("j2", EVERY_FIVE, Instant.parse("2026-01-01T12:05:00Z"));
        when(jobStore.findById("j1")).thenReturn(Optional.of(existing));
        when(frequencyStore.findById("f1")).thenReturn(Optional.of(EVERY_FIVE));
        when(jobStore.findByName("taken")).thenReturn(Optional.of(other));

        assertThrows(DuplicateNameException.class,
                () -> cronManager.updateJob("j1", definition("taken").build()));
    }

    @Test
    void setEnabledShouldFailForUnknownJob() {
        when(jobStore.findById("missing")).thenReturn(Optional.empty());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> cronManager.setEnabled("missing", true));

        assertEquals("No job found for id: missing", ex.getMessage());
    }

    @Test
    void disablingShouldPersistInactiveJob() {
        Job job = scheduledJob("j1", EVERY_FIVE, Instant.parse("2026-01-01T12:05:00Z"));
        when(jobStore.findById("j1")).thenReturn(Optional.of(job));
        when(jobStore.save(job)).thenReturn(job);

        Job saved = cronManager.setEnabled("j1", false);

        assertFalse(saved.isEnabled());
        assertEquals(JobStatus.INACTIVE, saved.getStatus());
    }

    @Test
    void findDueJobsShouldKeepOnlyJobsThatShouldRun() {
        Job due = scheduledJob("due", EVERY_FIVE, NOW.minusSeconds(60));
        Job tie = scheduledJob("tie", EVERY_FIVE, NOW);
        Job hung = scheduledJob("hung", EVERY_FIVE, NOW.minusSeconds(300));
        hung.setStatus(JobStatus.RUNNING);
        hung.setTimeout(30);
        hung.setLastRunDate(NOW.minusSeconds(60));
        Job busy = scheduledJob("busy", EVERY_FIVE, NOW.minusSeconds(300));
        busy.setStatus(JobStatus.RUNNING);
        busy.setTimeout(600);
        busy.setLastRunDate(NOW.minusSeconds(60));
        when(jobStore.findDueCandidates(NOW)).thenReturn(List.of(due, tie, hung, busy));

        List<Job> result = cronManager.findDueJobs();

        assertEquals(List.of(due, hung), result);
    }

    @Test
    void markRunningShouldReportLostRace() {
        Job job = scheduledJob("j1", EVERY_FIVE, NOW.minusSeconds(60));
        when(jobStore.claim(eq(job), any(Instant.class))).thenReturn(false);

        assertFalse(cronManager.markRunning(job));
        assertEquals(JobStatus.SCHEDULED, job.getStatus());
    }

    @Test
    void markRunningShouldUpdateClaimedJob() {
        Job job = scheduledJob("j1", EVERY_FIVE, NOW.minusSeconds(60));
        when(jobStore.claim(job, NOW)).thenReturn(true);

        assertTrue(cronManager.markRunning(job));
        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertEquals(NOW, job.getLastRunDate());
    }

    @Test
    void completeRunShouldDisableJobWhoseFrequencyVanished() {
        Job job = scheduledJob("j1", null, NOW.minusSeconds(60));
        job.setStatus(JobStatus.RUNNING);
        job.setLastRunDate(NOW.minusSeconds(30));
        when(jobStore.findById("j1")).thenReturn(Optional.of(job));
        when(jobStore.save(job)).thenReturn(job);

        Job saved = cronManager.completeRun("j1", true, 12.5);

        assertFalse(saved.isEnabled());
        assertEquals(JobStatus.INACTIVE, saved.getStatus());
        assertEquals(new RunStats(1, 1, 12.5), saved.getStats());
    }

    @Test
    void completeRunShouldRearmEnabledJob() {
        Job job = scheduledJob("j1", EVERY_FIVE, NOW.minusSeconds(60));
        job.setStatus(JobStatus.RUNNING);
        job.setLastRunDate(NOW.minusSeconds(30));
        when(jobStore.findById("j1")).thenReturn(Optional.of(job));
        when(jobStore.save(job)).thenReturn(job);

        Job saved = cronManager.completeRun("j1", false, 3);

        assertEquals(JobStatus.SCHEDULED, saved.getStatus());
        assertEquals(Instant.parse("2026-01-01T12:05:00Z"), saved.getNextRunDate());
        assertEquals(new RunStats(1, 0, 3), saved.getStats());
    }

    @Test
    void completeRunShouldIgnoreJobThatIsNotRunning() {
        Job job = scheduledJob("j1", EVERY_FIVE, Instant.parse("2026-01-01T12:05:00Z"));
        when(jobStore.findById("j1")).thenReturn(Optional.of(job));

        Job result = cronManager.completeRun("j1", true, 4);

        assertEquals(JobStatus.SCHEDULED, result.getStatus());
        assertEquals(Instant.parse("2026-01-01T12:05:00Z"), result.getNextRunDate());
        assertEquals(RunStats.empty(), result.getStats());
        verify(jobStore, never()).save(any());
    }

    @Test
    void validateClassTargetShouldUseRegistry() {
        cronManager.validateClassTarget("cleanup");

        assertThrows(InvalidTargetException.class, () -> cronManager.validateClassTarget("unknown"));
    }

    private static JobDefinition.Builder definition(String name) {
        return JobDefinition.builder()
                .name(name)
                .frequencyId("f1")
                .timezone("UTC")
                .url("https://example.com/" + name);
    }

    private static Job scheduledJob(String id, Frequency frequency, Instant nextRunDate) {
        Job job = new Job();
        job.setId(id);
        job.setName(id);
        job.setFrequency(frequency);
        job.setTimezone("UTC");
        job.setTargetType(TargetType.URL);
        job.setTarget("https://example.com/" + id);
        job.setEnabled(true);
        job.setStatus(JobStatus.SCHEDULED);
        job.setNextRunDate(nextRunDate);
        return job;
    }
}
