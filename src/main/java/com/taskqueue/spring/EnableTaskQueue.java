package com.taskqueue.spring;

import com.taskqueue.adapter.spring.TaskQueueAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Registers a shared {@code TaskQueue<Object>} in the application context,
 * configured from {@code taskqueue.config-path}. Producers and consumers
 * inject the same bean; it orders tasks by priority and FIFO within a priority.
 *
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableTaskQueue
 * public class Workers {
 *     &#64;Bean
 *     CommandLineRunner produce(TaskQueue&lt;Object&gt; queue) {
 *         return args -&gt; queue.add("reindex", Priority.HIGH);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(TaskQueueAutoConfiguration.class)
public @interface EnableTaskQueue {
}
