package io.cronmanager.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.cronmanager.core.DuplicateNameException;
import io.cronmanager.core.Frequency;
import io.cronmanager.core.Job;
import io.cronmanager.core.JobStatus;
import io.cronmanager.core.RunStats;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Jobs reference their frequency by id; the frequency is resolved on every read so a job always
 * sees the current mask. A job whose frequency no longer exists is returned with a null frequency.
 */
public class MongoJobStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Insert or replace a job.
     *
     * @return the stored job, with its generated id when it was new
     * @throws DuplicateNameException if the unique name index rejects the write
     */
    public Job save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            JobDocument saved = mongoTemplate.save(toDocument(job));
            job.setId(saved.getId());
            return job;
        } catch (DuplicateKeyException e) {
            throw new DuplicateNameException(job.getName());
        }
    }

    public Optional<Job> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class))
                .map(doc -> toJob(doc, resolveFrequencies(List.of(doc))));
    }

    public Optional<Job> findByName(String name) {
        Query q = new Query(Criteria.where("name").is(name));
        return Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class))
                .map(doc -> toJob(doc, resolveFrequencies(List.of(doc))));
    }

    public List<Job> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("name")));
        return toJobs(mongoTemplate.find(q, JobDocument.class));
    }

    public List<Job> findByFrequencyId(String frequencyId) {
        Query q = new Query(Criteria.where("frequencyId").is(frequencyId));
        return toJobs(mongoTemplate.find(q, JobDocument.class));
    }

    public long countByFrequencyId(String frequencyId) {
        Query q = new Query(Criteria.where("frequencyId").is(frequencyId));
        return mongoTemplate.count(q, JobDocument.class);
    }

    /**
     * Enabled jobs that may be due at {@code now}: running jobs, or jobs whose next run date
     * has passed. Callers still decide per job with the scheduler.
     */
    public List<Job> findDueCandidates(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(
                Criteria.where("enabled").is(true)
                        .orOperator(
                                Criteria.where("status").is(JobStatus.RUNNING),
                                Criteria.where("nextRunDate").lt(now)
                        )
        );
        q.with(Sort.by(Sort.Order.asc("nextRunDate")));
        return toJobs(mongoTemplate.find(q, JobDocument.class));
    }

    /**
     * Atomically moves a job into RUNNING, but only if the stored job still has the
     * {@code enabled}, {@code status} and {@code lastRunDate} values the caller read.
     *
     * <p>Two runners that read the same job race on this update; exactly one of them wins.
     *
     * @return true if this caller claimed the job
     */
    public boolean claim(Job seen, Instant startedAt) {
        Objects.requireNonNull(seen, "seen must not be null");
        Objects.requireNonNull(seen.getId(), "seen.id must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(seen.getId())
                        .and("enabled").is(true)
                        .and("status").is(seen.getStatus())
                        .and("lastRunDate").is(seen.getLastRunDate())
        );

        Update u = new Update()
                .set("status", JobStatus.RUNNING)
                .set("lastRunDate", startedAt);

        UpdateResult r = mongoTemplate.updateFirst(q, u, JobDocument.class);
        return r.getModifiedCount() > 0;
    }

    /**
     * Hard delete job by document id.
     *
     * @return deleted count (0 or 1 normally)
     */
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, JobDocument.class).getDeletedCount();
    }

    private List<Job> toJobs(List<JobDocument> docs) {
        Map<String, Frequency> frequencies = resolveFrequencies(docs);
        return docs.stream()
                .map(doc -> toJob(doc, frequencies))
                .toList();
    }

    private Map<String, Frequency> resolveFrequencies(Collection<JobDocument> docs) {
        List<String> ids = docs.stream()
                .map(JobDocument::getFrequencyId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return Map.of();
        }

        Query q = new Query(Criteria.where("_id").in(ids));
        return mongoTemplate.find(q, FrequencyDocument.class).stream()
                .map(FrequencyDocument::toFrequency)
                .collect(Collectors.toMap(Frequency::id, Function.identity()));
    }

    private JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.getId());
        doc.setName(job.getName());
        doc.setDescription(job.getDescription());
        doc.setFrequencyId(job.getFrequency() == null ? null : job.getFrequency().id());
        doc.setTimezone(job.getTimezone());
        doc.setEnabled(job.isEnabled());
        doc.setTargetType(job.getTargetType());
        doc.setTarget(job.getTarget());
        doc.setTimeout(job.getTimeout());
        doc.setStatus(job.getStatus());
        doc.setNextRunDate(job.getNextRunDate());
        doc.setLastRunDate(job.getLastRunDate());
        doc.setStats(objectMapper.convertValue(job.getStats(), new TypeReference<>() {
        }));
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}.
     */
    Job toJob(JobDocument doc, Map<String, Frequency> frequencies) {
        Objects.requireNonNull(doc, "doc must not be null");

        Job job = new Job();
        job.setId(doc.getId());
        job.setName(doc.getName());
        job.setDescription(doc.getDescription());
        job.setFrequency(doc.getFrequencyId() == null ? null : frequencies.get(doc.getFrequencyId()));
        job.setTimezone(doc.getTimezone());
        job.setEnabled(doc.isEnabled());
        job.setTargetType(doc.getTargetType());
        job.setTarget(doc.getTarget());
        job.setTimeout(doc.getTimeout());
        job.setStatus(doc.getStatus() == null ? JobStatus.INACTIVE : doc.getStatus());
        job.setNextRunDate(doc.getNextRunDate());
        job.setLastRunDate(doc.getLastRunDate());

        Map<String, Object> raw = doc.getStats();
        job.setStats(raw == null ? null : objectMapper.convertValue(raw, RunStats.class));
        return job;
    }
}
