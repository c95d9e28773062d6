package io.taskrunner4j.config;

import io.taskrunner4j.TaskEngine;
import io.taskrunner4j.internal.DefaultTaskEngine;
import io.taskrunner4j.internal.StaticRuntimeResolver;
import io.taskrunner4j.internal.mongo.MongoExecutionStore;
import io.taskrunner4j.internal.mongo.MongoLogStore;
import io.taskrunner4j.internal.mongo.MongoTaskStore;
import io.taskrunner4j.spi.ExecutionStore;
import io.taskrunner4j.spi.LogStore;
import io.taskrunner4j.spi.RuntimeResolver;
import io.taskrunner4j.spi.TaskStore;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the task engine.
 *
 * <p>Every bean backs off when the application defines its own, so a custom {@link RuntimeResolver} or store
 * replaces the default one.
 */
@AutoConfiguration
@ConditionalOnClass({TaskEngine.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "taskrunner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TaskRunnerConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "taskrunner")
    public TaskRunnerProperties taskRunnerProperties() {
        return new TaskRunnerProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore(MongoTemplate mongoTemplate) {
        return new MongoTaskStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionStore executionStore(MongoTemplate mongoTemplate) {
        return new MongoExecutionStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public LogStore logStore(MongoTemplate mongoTemplate) {
        return new MongoLogStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public RuntimeResolver runtimeResolver(TaskRunnerProperties props) {
        return StaticRuntimeResolver.fromProperties(props);
    }

    @Bean
    @ConditionalOnMissingBean
    protected TaskRunnerMongoIndexConfig taskRunnerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new TaskRunnerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskEngine taskEngine(TaskRunnerProperties props,
                                 TaskStore taskStore,
                                 ExecutionStore executionStore,
                                 LogStore logStore,
                                 RuntimeResolver runtimeResolver) {
        return new DefaultTaskEngine(props, taskStore, executionStore, logStore, runtimeResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRunnerLifecycle taskRunnerLifecycle(TaskEngine taskEngine, TaskRunnerProperties props) {
        return new TaskRunnerLifecycle(taskEngine, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "taskrunner", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton taskRunnerIndexesInitializer(TaskRunnerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
