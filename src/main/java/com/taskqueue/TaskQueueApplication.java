package com.taskqueue;

import com.taskqueue.core.TaskQueue;
import com.taskqueue.priority.Priority;
import com.taskqueue.spring.EnableTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Example Spring Boot application demonstrating queue usage.
 */
@SpringBootApplication
@EnableTaskQueue
public class TaskQueueApplication {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TaskQueueApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TaskQueue<Object> taskQueue) {
        return args -> {
            log.info("=== TaskQueue Demo Started ===");

            taskQueue.add("Update documentation", Priority.LOW);
            taskQueue.add("Fix critical bug", Priority.HIGH);
            taskQueue.add("Implement new feature", Priority.MEDIUM);
            taskQueue.add("Security patch", Priority.HIGH);
            taskQueue.add("Code review");

            log.info("Queue size: {}, next task: {}", taskQueue.size(), taskQueue.peek().orElse(null));
            while (!taskQueue.isEmpty()) {
                log.info("Processing: {}", taskQueue.take().orElse(null));
            }

            // Producers racing on the same queue
            int producers = 3;
            int tasksPerProducer = 3;
            ExecutorService pool = Executors.newFixedThreadPool(producers);
            List<Runnable> jobs = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producerId = p;
                jobs.add(() -> {
                    for (int i = 0; i < tasksPerProducer; i++) {
                        Priority priority = i == 0 ? Priority.HIGH : Priority.MEDIUM;
                        taskQueue.add("Task " + i + " from producer " + producerId, priority);
                    }
                });
            }
            jobs.forEach(pool::execute);
            pool.shutdown();
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Producers did not finish within 10 seconds");
                pool.shutdownNow();
            }

            log.info("Total tasks added by {} producers: {}", producers, taskQueue.size());
            taskQueue.drain().forEach(task -> log.info("Drained: {}", task));
            log.info("Stats: {}", taskQueue.stats());
            log.info("=== TaskQueue Demo Completed ===");
        };
    }
}
