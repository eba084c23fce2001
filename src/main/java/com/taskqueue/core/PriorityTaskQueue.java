package com.taskqueue.core;

import com.taskqueue.config.QueueConfig;
import com.taskqueue.exception.EmptyQueueException;
import com.taskqueue.exception.InvalidPriorityException;
import com.taskqueue.exception.InvalidTaskException;
import com.taskqueue.priority.Priority;
import com.taskqueue.priority.TaskKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Default implementation of TaskQueue.
 * <p>
 * A binary heap ordered by (priority, sequence) and the sequence counter are
 * guarded together by a single monitor, so each public operation is one
 * critical section:
 * - add assigns the sequence and inserts in the same step
 * - take/peek/size/stats observe a state that existed at one point in time
 * - clear empties the heap and resets the counter atomically
 * <p>
 * Payloads are never inspected beyond the null/empty-text policy check.
 *
 * @param <T> Payload type
 */
public class PriorityTaskQueue<T> implements TaskQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(PriorityTaskQueue.class);

    private static final long INITIAL_SEQUENCE = 0L;

    private final String name;
    private final EmptyQueueMode emptyQueueMode;
    private final Object monitor = new Object();

    // Guarded by monitor
    private final PriorityQueue<QueuedTask<T>> heap;
    private final int[] residentByPriority = new int[Priority.values().length];
    private long nextSequence = INITIAL_SEQUENCE;
    private long addedCount;
    private long takenCount;
    private long discardedCount;

    public PriorityTaskQueue() {
        this(QueueConfig.defaults());
    }

    public PriorityTaskQueue(EmptyQueueMode emptyQueueMode) {
        this(QueueConfig.defaults().withEmptyQueueMode(emptyQueueMode));
    }

    public PriorityTaskQueue(QueueConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.name = config.name();
        this.emptyQueueMode = Objects.requireNonNull(config.emptyQueueMode(), "emptyQueueMode cannot be null");
        this.heap = new PriorityQueue<>(config.initialCapacity());
        log.info("PriorityTaskQueue '{}' initialized (mode={}, initialCapacity={})",
                name, emptyQueueMode, config.initialCapacity());
    }

    @Override
    public void add(T payload, Priority priority) {
        if (priority == null) {
            log.warn("Queue '{}' rejected task with null priority", name);
            throw new InvalidPriorityException("Priority cannot be null");
        }
        validatePayload(payload);

        long sequence;
        synchronized (monitor) {
            sequence = nextSequence++;
            heap.offer(new QueuedTask<>(payload, new TaskKey(priority, sequence)));
            residentByPriority[priority.ordinal()]++;
            addedCount++;
        }
        log.trace("Task enqueued to '{}' (priority={}, sequence={})", name, priority, sequence);
    }

    @Override
    public void add(T payload, int level) {
        Priority priority;
        try {
            priority = Priority.of(level);
        } catch (InvalidPriorityException e) {
            log.warn("Queue '{}' rejected task with priority level {}", name, level);
            throw e;
        }
        add(payload, priority);
    }

    @Override
    public void add(T payload) {
        add(payload, Priority.MEDIUM);
    }

    @Override
    public Optional<T> take() {
        QueuedTask<T> task;
        synchronized (monitor) {
            task = heap.poll();
            if (task != null) {
                residentByPriority[task.getPriority().ordinal()]--;
                takenCount++;
            }
        }
        if (task == null) {
            return onEmpty();
        }
        log.trace("Task dequeued from '{}' ({})", name, task);
        return Optional.of(task.getPayload());
    }

    @Override
    public Optional<T> peek() {
        QueuedTask<T> task;
        synchronized (monitor) {
            task = heap.peek();
        }
        if (task == null) {
            return onEmpty();
        }
        return Optional.of(task.getPayload());
    }

    @Override
    public List<T> drain() {
        List<T> drained;
        synchronized (monitor) {
            drained = new ArrayList<>(heap.size());
            QueuedTask<T> task;
            while ((task = heap.poll()) != null) {
                drained.add(task.getPayload());
            }
            takenCount += drained.size();
            resetResidentCounts();
        }
        log.debug("Drained {} tasks from '{}'", drained.size(), name);
        return drained;
    }

    @Override
    public int size() {
        synchronized (monitor) {
            return heap.size();
        }
    }

    @Override
    public boolean isEmpty() {
        synchronized (monitor) {
            return heap.isEmpty();
        }
    }

    @Override
    public void clear() {
        int discarded;
        synchronized (monitor) {
            discarded = heap.size();
            heap.clear();
            resetResidentCounts();
            nextSequence = INITIAL_SEQUENCE;
            discardedCount += discarded;
        }
        log.debug("Cleared queue '{}', {} tasks discarded", name, discarded);
    }

    @Override
    public QueueStats stats() {
        synchronized (monitor) {
            Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
            for (Priority priority : Priority.values()) {
                byPriority.put(priority, residentByPriority[priority.ordinal()]);
            }
            return new QueueStats(name, emptyQueueMode, heap.size(), byPriority,
                    addedCount, takenCount, discardedCount);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public EmptyQueueMode getEmptyQueueMode() {
        return emptyQueueMode;
    }

    /**
     * Sequence the next accepted task will receive.
     */
    long nextSequence() {
        synchronized (monitor) {
            return nextSequence;
        }
    }

    private Optional<T> onEmpty() {
        if (emptyQueueMode == EmptyQueueMode.STRICT) {
            throw new EmptyQueueException(name);
        }
        return Optional.empty();
    }

    private void validatePayload(T payload) {
        if (payload == null) {
            log.warn("Queue '{}' rejected null task", name);
            throw new InvalidTaskException("Task cannot be null");
        }
        if (payload instanceof CharSequence text && text.length() == 0) {
            log.warn("Queue '{}' rejected empty task", name);
            throw new InvalidTaskException("Task cannot be empty");
        }
    }

    private void resetResidentCounts() {
        Arrays.fill(residentByPriority, 0);
    }

    @Override
    public String toString() {
        return "PriorityTaskQueue{" +
                "name='" + name + '\'' +
                ", mode=" + emptyQueueMode +
                ", size=" + size() +
                '}';
    }
}
