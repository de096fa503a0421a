package io.cronmanager.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronmanager.CronManager;
import io.cronmanager.JobTarget;
import io.cronmanager.core.FrequencyValidator;
import io.cronmanager.core.JobScheduler;
import io.cronmanager.core.JobTargetRegistry;
import io.cronmanager.internal.mongo.MongoCronManager;
import io.cronmanager.internal.mongo.MongoFrequencyStore;
import io.cronmanager.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for cron manager components.
 */
@AutoConfiguration
@ConditionalOnClass({CronManager.class, MongoTemplate.class})
@EnableConfigurationProperties(CronManagerProperties.class)
@ConditionalOnProperty(prefix = "cron-manager", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronManagerConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoFrequencyStore mongoFrequencyStore(MongoTemplate mongoTemplate) {
        return new MongoFrequencyStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronManagerMongoIndexConfig cronManagerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new CronManagerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobTargetRegistry jobTargetRegistry(ObjectProvider<List<JobTarget>> targetsProvider) {
        List<JobTarget> targets = targetsProvider.getIfAvailable(List::of);
        return new JobTargetRegistry(targets);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler() {
        return new JobScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public FrequencyValidator frequencyValidator() {
        return new FrequencyValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock cronManagerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronManager cronManager(CronManagerProperties props,
                                   MongoJobStore jobStore,
                                   MongoFrequencyStore frequencyStore,
                                   JobScheduler scheduler,
                                   FrequencyValidator validator,
                                   JobTargetRegistry targetRegistry,
                                   Clock clock) {
        return new MongoCronManager(props, jobStore, frequencyStore, scheduler, validator, targetRegistry, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cron-manager", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronManagerIndexesInitializer(CronManagerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
