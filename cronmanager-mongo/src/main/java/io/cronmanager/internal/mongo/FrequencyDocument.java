package io.cronmanager.internal.mongo;

import io.cronmanager.core.Frequency;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Mongo document model for frequencies (named cron masks).
 */
@Document(collection = FrequencyDocument.COLLECTION)
public class FrequencyDocument {

    public static final String COLLECTION = "cron_manager_job_frequencies";

    @Id
    private String id;

    private String name;
    private String mask;

    public FrequencyDocument() {
    }

    static FrequencyDocument from(Frequency frequency) {
        FrequencyDocument doc = new FrequencyDocument();
        doc.setId(frequency.id());
        doc.setName(frequency.name());
        doc.setMask(frequency.mask());
        return doc;
    }

    Frequency toFrequency() {
        return new Frequency(id, name, mask);
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

    public String getMask() {
        return mask;
    }

    public void setMask(String mask) {
        this.mask = mask;
    }
}
