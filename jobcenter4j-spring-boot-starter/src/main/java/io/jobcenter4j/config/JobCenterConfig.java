package io.jobcenter4j.config;

import io.jobcenter4j.ExecutionNotifier;
import io.jobcenter4j.JobCenter;
import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.core.JobExecutorRegistry;
import io.jobcenter4j.internal.DefaultJobCenter;
import io.jobcenter4j.internal.mongo.MongoJobStore;
import io.jobcenter4j.store.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the job center.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration",
        "org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration"
})
@ConditionalOnClass({JobCenter.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "jobcenter", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(JobCenterNotificationProperties.class)
@Import(JobCenterExecutorConfig.class)
public class JobCenterConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "jobcenter")
    public JobCenterProperties jobCenterProperties() {
        return new JobCenterProperties();
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobCenterMongoIndexConfig jobCenterMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new JobCenterMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutorRegistry jobExecutorRegistry(ObjectProvider<JobExecutor> executors) {
        List<JobExecutor> all = executors.orderedStream().toList();
        return new JobExecutorRegistry(all);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCenter jobCenter(JobCenterProperties props,
                               JobStore jobStore,
                               JobExecutorRegistry registry,
                               ObjectProvider<ExecutionNotifier> notifier,
                               ObjectProvider<Clock> clock) {
        return new DefaultJobCenter(props, jobStore, registry, notifier.getIfAvailable(),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCenterLifecycle jobCenterLifecycle(JobCenter jobCenter, JobCenterProperties props) {
        return new JobCenterLifecycle(jobCenter, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobcenter", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobCenterIndexesInitializer(JobCenterMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
