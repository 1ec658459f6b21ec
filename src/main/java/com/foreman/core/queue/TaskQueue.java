package com.foreman.core.queue;

import com.foreman.core.metrics.ForemanMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe priority queue of pending tasks.
 * <p>
 * Tasks leave in descending priority; within one priority they leave in
 * creation order, and tasks created in the same instant leave in enqueue order.
 * A single lock guards both the heap and the id lookup table, so every
 * operation is serialized.
 * <p>
 * Reprioritizing or removing a task rebuilds the heap, which is O(n). That is
 * fine for queues of a few hundred tasks; an indexed heap keyed by task id would
 * be needed for much deeper queues.
 */
@Service
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt(Entry::priority).reversed()
            .thenComparing(Entry::createdAt)
            .thenComparingLong(Entry::sequence);

    /** Heap key frozen at insert or rebuild time; the task's priority may only change under the lock. */
    private record Entry(int priority, Instant createdAt, long sequence, Task task) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private final Map<String, Task> tasksById = new HashMap<>();
    private final ForemanMetrics metrics;
    private long nextSequence;

    public TaskQueue() {
        this(null);
    }

    @Autowired
    public TaskQueue(@Autowired(required = false) ForemanMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Adds a task to the queue.
     *
     * @throws TaskValidationException if the task is null, has no id, has a negative
     *                                 priority, or its id is already queued
     */
    public void enqueue(Task task) {
        if (task == null) {
            throw new TaskValidationException(TaskValidationException.Reason.NULL_TASK, "Task cannot be null");
        }
        if (task.getTaskId() == null || task.getTaskId().isBlank()) {
            throw new TaskValidationException(TaskValidationException.Reason.MISSING_ID,
                    "Task must have a valid task id");
        }
        if (task.getPriority() < 0) {
            throw new TaskValidationException(TaskValidationException.Reason.NEGATIVE_PRIORITY,
                    "Task " + task.getTaskId() + " has negative priority " + task.getPriority());
        }

        int depth;
        lock.lock();
        try {
            if (tasksById.containsKey(task.getTaskId())) {
                throw new TaskValidationException(TaskValidationException.Reason.DUPLICATE_ID,
                        "Task with id " + task.getTaskId() + " already in queue");
            }
            tasksById.put(task.getTaskId(), task);
            heap.add(new Entry(task.getPriority(), task.getCreatedAt(), nextSequence++, task));
            depth = heap.size();
        } finally {
            lock.unlock();
        }

        log.debug("Enqueued {} (priority {}, agent {}), depth {}",
                task.getTaskId(), task.getPriority(), task.getAgentType(), depth);
        if (metrics != null) {
            metrics.recordTaskEnqueued(task.getAgentType());
            metrics.recordQueueDepth(depth);
        }
    }

    /**
     * Removes and returns the most urgent task. Never blocks.
     *
     * @return the next task, or empty if the queue is empty
     */
    public Optional<Task> dequeue() {
        Task task;
        int depth;
        lock.lock();
        try {
            Entry entry = heap.poll();
            if (entry == null) {
                return Optional.empty();
            }
            task = entry.task();
            tasksById.remove(task.getTaskId());
            depth = heap.size();
        } finally {
            lock.unlock();
        }

        log.debug("Dequeued {} (priority {}), depth {}", task.getTaskId(), task.getPriority(), depth);
        if (metrics != null) {
            metrics.recordTaskDequeued(task.getAgentType());
            metrics.recordQueueDepth(depth);
        }
        return Optional.of(task);
    }

    /**
     * Returns the task {@link #dequeue()} would return, without removing it.
     */
    public Optional<Task> peek() {
        lock.lock();
        try {
            Entry entry = heap.peek();
            return entry != null ? Optional.of(entry.task()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public int getPendingCount() {
        lock.lock();
        try {
            return heap.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return getPendingCount() == 0;
    }

    /**
     * Changes the priority of a queued task. The new priority applies to the very next dequeue.
     *
     * @return true if the task was found and updated, false if it is not queued
     * @throws TaskValidationException if {@code newPriority} is negative
     */
    public boolean prioritizeTask(String taskId, int newPriority) {
        if (newPriority < 0) {
            throw new TaskValidationException(TaskValidationException.Reason.NEGATIVE_PRIORITY,
                    "Priority cannot be negative: " + newPriority);
        }

        lock.lock();
        try {
            Task task = tasksById.get(taskId);
            if (task == null) {
                return false;
            }
            int previous = task.getPriority();
            task.setPriority(newPriority);
            rebuild(null);
            log.debug("Reprioritized {} from {} to {}", taskId, previous, newPriority);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> getTaskById(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(tasksById.get(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels a pending task.
     *
     * @return true if the task was queued and has been removed
     */
    public boolean removeTask(String taskId) {
        lock.lock();
        try {
            if (tasksById.remove(taskId) == null) {
                return false;
            }
            rebuild(taskId);
        } finally {
            lock.unlock();
        }

        log.debug("Removed {} from queue", taskId);
        if (metrics != null) {
            metrics.recordTaskCancelled();
        }
        return true;
    }

    public void clear() {
        lock.lock();
        try {
            heap.clear();
            tasksById.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every queued task in dequeue order. The queue is not modified.
     */
    public List<Task> getAllTasks() {
        lock.lock();
        try {
            var entries = new ArrayList<>(heap);
            entries.sort(ORDER);
            return entries.stream().map(Entry::task).toList();
        } finally {
            lock.unlock();
        }
    }

    /** Re-keys every entry from its task's current priority, dropping {@code excludedId}. Caller holds the lock. */
    private void rebuild(String excludedId) {
        var entries = new ArrayList<>(heap);
        heap.clear();
        for (Entry entry : entries) {
            Task task = entry.task();
            if (task.getTaskId().equals(excludedId)) {
                continue;
            }
            heap.add(new Entry(task.getPriority(), entry.createdAt(), entry.sequence(), task));
        }
    }
}
