package io.cronmanager.internal.mongo;

import io.cronmanager.core.DuplicateMaskException;
import io.cronmanager.core.DuplicateNameException;
import io.cronmanager.core.Frequency;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for frequencies.
 */
public class MongoFrequencyStore {

    /**
     * Name of the unique index on {@code name}; used to tell name clashes from mask clashes.
     */
    public static final String NAME_INDEX = "ux_frequency_name";

    private final MongoTemplate mongoTemplate;

    public MongoFrequencyStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Insert or replace a frequency.
     *
     * @return the stored frequency, with its generated id when it was new
     * @throws DuplicateNameException if the unique name index rejects the write
     * @throws DuplicateMaskException if the unique mask index rejects the write
     */
    public Frequency save(Frequency frequency) {
        Objects.requireNonNull(frequency, "frequency must not be null");
        try {
            return mongoTemplate.save(FrequencyDocument.from(frequency)).toFrequency();
        } catch (DuplicateKeyException e) {
            if (e.getMessage() != null && e.getMessage().contains(NAME_INDEX)) {
                throw duplicateName(frequency.name());
            }
            throw new DuplicateMaskException(frequency.mask());
        }
    }

    static DuplicateNameException duplicateName(String name) {
        return new DuplicateNameException(name, "A frequency with this name already exists: " + name);
    }

    public Optional<Frequency> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, FrequencyDocument.class))
                .map(FrequencyDocument::toFrequency);
    }

    public Optional<Frequency> findByName(String name) {
        Query q = new Query(Criteria.where("name").is(name));
        return Optional.ofNullable(mongoTemplate.findOne(q, FrequencyDocument.class))
                .map(FrequencyDocument::toFrequency);
    }

    public List<Frequency> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("name")));
        return mongoTemplate.find(q, FrequencyDocument.class).stream()
                .map(FrequencyDocument::toFrequency)
                .toList();
    }

    /**
     * Masks of all stored frequencies, optionally leaving one out (the one being edited).
     */
    public List<String> findMasks(String excludeId) {
        Query q = excludeId == null
                ? new Query()
                : new Query(Criteria.where("_id").ne(excludeId));
        q.fields().include("mask");
        return mongoTemplate.find(q, FrequencyDocument.class).stream()
                .map(FrequencyDocument::getMask)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Hard delete frequency by document id.
     *
     * @return deleted count (0 or 1 normally)
     */
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, FrequencyDocument.class).getDeletedCount();
    }
}
