package io.cronmanager.config;

import io.cronmanager.internal.mongo.FrequencyDocument;
import io.cronmanager.internal.mongo.JobDocument;
import io.cronmanager.internal.mongo.MongoFrequencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the cron manager.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code cron-manager.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Collection {@code cron_manager_jobs}</h3>
 * <ul>
 *   <li><b>ux_job_name</b> (unique): { name: 1 }
 *       <br/>Job names are unique; a duplicate insert surfaces as a duplicate-name error.</li>
 *   <li><b>idx_enabled_next_run</b>: { enabled: 1, nextRunDate: 1 }
 *       <br/>Used when looking up due jobs.</li>
 *   <li><b>idx_frequency</b>: { frequencyId: 1 }
 *       <br/>Used for mask-edit rescheduling and the in-use check on frequency deletion.</li>
 * </ul>
 *
 * <h3>Collection {@code cron_manager_job_frequencies}</h3>
 * <ul>
 *   <li><b>ux_frequency_name</b> (unique): { name: 1 }</li>
 *   <li><b>ux_frequency_mask</b> (unique): { mask: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.cron_manager_jobs.createIndex({ name: 1 }, { name: "ux_job_name", unique: true });
 * db.cron_manager_jobs.createIndex({ enabled: 1, nextRunDate: 1 }, { name: "idx_enabled_next_run" });
 * db.cron_manager_jobs.createIndex({ frequencyId: 1 }, { name: "idx_frequency" });
 * db.cron_manager_job_frequencies.createIndex({ name: 1 }, { name: "ux_frequency_name", unique: true });
 * db.cron_manager_job_frequencies.createIndex({ mask: 1 }, { name: "ux_frequency_mask", unique: true });
 * </pre>
 */
public class CronManagerMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(CronManagerMongoIndexConfig.class);

    public static final String UX_JOB_NAME = "ux_job_name";
    public static final String IDX_ENABLED_NEXT_RUN = "idx_enabled_next_run";
    public static final String IDX_FREQUENCY = "idx_frequency";
    public static final String UX_FREQUENCY_NAME = MongoFrequencyStore.NAME_INDEX;
    public static final String UX_FREQUENCY_MASK = "ux_frequency_mask";

    private final MongoTemplate mongoTemplate;

    public CronManagerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create the indexes listed above. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).createIndex(jobNameUniqueIndex());
        mongoTemplate.indexOps(JobDocument.class).createIndex(enabledNextRunIndex());
        mongoTemplate.indexOps(JobDocument.class).createIndex(frequencyIndex());
        mongoTemplate.indexOps(FrequencyDocument.class).createIndex(frequencyNameUniqueIndex());
        mongoTemplate.indexOps(FrequencyDocument.class).createIndex(frequencyMaskUniqueIndex());
        log.info("Cron manager indexes ensured on {} and {}", JobDocument.COLLECTION, FrequencyDocument.COLLECTION);
    }

    /**
     * Keys: name ASC. Options: unique
     */
    public static Index jobNameUniqueIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .unique()
                .named(UX_JOB_NAME);
    }

    /**
     * Keys: enabled ASC, nextRunDate ASC
     */
    public static Index enabledNextRunIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRunDate", Sort.Direction.ASC)
                .named(IDX_ENABLED_NEXT_RUN);
    }

    public static Index frequencyIndex() {
        return new Index()
                .on("frequencyId", Sort.Direction.ASC)
                .named(IDX_FREQUENCY);
    }

    /**
     * Keys: name ASC. Options: unique
     */
    public static Index frequencyNameUniqueIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .unique()
                .named(UX_FREQUENCY_NAME);
    }

    /**
     * Keys: mask ASC. Options: unique
     */
    public static Index frequencyMaskUniqueIndex() {
        return new Index()
                .on("mask", Sort.Direction.ASC)
                .unique()
                .named(UX_FREQUENCY_MASK);
    }
}
