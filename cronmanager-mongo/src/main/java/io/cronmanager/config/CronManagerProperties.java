package io.cronmanager.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the cron manager.
 */
@ConfigurationProperties(prefix = "cron-manager")
public class CronManagerProperties {
    private boolean enabled = true;
    private String defaultTimezone = "UTC"; // zone used for mask previews
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
