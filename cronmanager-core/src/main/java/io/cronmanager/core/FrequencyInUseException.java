package io.cronmanager.core;

/**
 * Thrown when deleting a frequency that is still referenced by at least one job.
 */
public class FrequencyInUseException extends IllegalStateException {

    private final String frequencyId;
    private final long referencingJobs;

    public FrequencyInUseException(String frequencyId, long referencingJobs) {
        super("Frequency " + frequencyId + " is still used by " + referencingJobs + " job(s)");
        this.frequencyId = frequencyId;
        this.referencingJobs = referencingJobs;
    }

    public String getFrequencyId() {
        return frequencyId;
    }

    public long getReferencingJobs() {
        return referencingJobs;
    }
}
