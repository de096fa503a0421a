package io.cronmanager.core;

import io.cronmanager.JobTarget;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Explicitly registered in-process targets for {@link TargetType#CLASS} jobs.
 */
public class JobTargetRegistry {

    private final Map<String, JobTarget> targetsByName;

    public JobTargetRegistry(List<JobTarget> targets) {
        this.targetsByName = targets.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobTarget::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobTarget name: " + a.name());
                        }
                ));
    }

    public Optional<JobTarget> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(targetsByName.get(name.trim()));
    }

    public JobTarget getRequired(String name) {
        return find(name).orElseThrow(
                () -> new InvalidTargetException("No JobTarget registered for name: " + name));
    }

    /**
     * Checks that a {@link TargetType#CLASS} target names a registered {@link JobTarget}.
     *
     * @throws InvalidTargetException if the name is blank or unknown
     */
    public void validate(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidTargetException("Target name must not be blank");
        }
        getRequired(name);
    }

    public Set<String> names() {
        return targetsByName.keySet();
    }
}
