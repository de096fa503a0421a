package io.cronmanager.core;

import io.cronmanager.utils.Timezones;

import java.util.Objects;

/**
 * Operator input for creating or editing a job.
 * This is a pure data object; scheduling state is derived from it by {@link JobScheduler}.
 */
public record JobDefinition(
        String name,
        String description,
        String frequencyId,
        String timezone,
        TargetType targetType,
        String target,
        int timeout,
        boolean enabled
) {

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String description;
        private String frequencyId;
        private String timezone;
        private TargetType targetType;
        private String target;
        private int timeout;
        private boolean enabled;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder frequencyId(String frequencyId) {
            this.frequencyId = frequencyId;
            return this;
        }

        /**
         * IANA time zone id; the display form with spaces ("America/New York") is accepted.
         */
        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder url(String url) {
            this.targetType = TargetType.URL;
            this.target = url;
            return this;
        }

        public Builder targetClass(String targetName) {
            this.targetType = TargetType.CLASS;
            this.target = targetName;
            return this;
        }

        public Builder target(TargetType targetType, String target) {
            this.targetType = targetType;
            this.target = target;
            return this;
        }

        /**
         * Seconds after which a running job is considered hung.
         */
        public Builder timeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public JobDefinition build() {
            requireText(name, "name");
            requireText(frequencyId, "frequencyId");
            requireText(timezone, "timezone");
            Objects.requireNonNull(targetType, "targetType must not be null");
            requireText(target, "target");
            if (timeout < 0) {
                throw new IllegalArgumentException("timeout must not be negative: " + timeout);
            }
            Timezones.parse(timezone);

            return new JobDefinition(
                    name.trim(),
                    description,
                    frequencyId,
                    timezone,
                    targetType,
                    target.trim(),
                    timeout,
                    enabled
            );
        }

        private static void requireText(String value, String field) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(field + " must not be blank");
            }
        }
    }
}
