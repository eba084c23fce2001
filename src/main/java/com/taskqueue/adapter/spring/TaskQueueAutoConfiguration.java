package com.taskqueue.adapter.spring;

import com.taskqueue.config.ConfigLoader;
import com.taskqueue.config.QueueConfig;
import com.taskqueue.core.PriorityTaskQueue;
import com.taskqueue.core.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the task queue.
 * <p>
 * Registers a {@link QueueConfig} read from {@code taskqueue.config-path} and a
 * {@link TaskQueue} built from it. Either bean can be replaced by declaring one
 * of the same type. The queue needs no shutdown hook: pending tasks are simply
 * released with the context.
 */
@Configuration
@ConditionalOnProperty(prefix = "taskqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TaskQueueProperties.class)
public class TaskQueueAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public QueueConfig queueConfig(TaskQueueProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueue<Object> taskQueue(QueueConfig config) {
        log.info("Creating PriorityTaskQueue: {}", config.name());
        return new PriorityTaskQueue<>(config);
    }
}
