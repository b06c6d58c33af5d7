package scrapeflow.engine.scheduler;

import scrapeflow.engine.model.Task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority-ordered hand-off between the master and its workers.
 *
 * Higher priority is taken first, equal priorities in ascending id order.
 * Closing the queue is the run's shutdown signal: once closed and empty,
 * {@link #take()} returns {@code null} instead of blocking.
 */
public final class TaskQueue {

    static final Comparator<Task> ADMISSION_ORDER = Comparator
            .<Task>comparingInt(Task::priority).reversed()
            .thenComparingInt(Task::id);

    /**
     * A task handed to a worker.
     *
     * @param task         the task
     * @param sequence     1-based admission order
     * @param dispatchedAt when the task left the queue
     */
    public record Dispatch(Task task, long sequence, Instant dispatchedAt) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final PriorityQueue<Task> pending = new PriorityQueue<>(ADMISSION_ORDER);

    private long sequence;
    private boolean closed;

    public void addAll(Collection<Task> tasks) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Queue is closed");
            }
            pending.addAll(tasks);
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the next task, waiting while the queue is empty and still open.
     *
     * @return the next dispatch, or {@code null} once the queue is closed and drained
     */
    public Dispatch take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !closed) {
                available.await();
            }
            Task next = pending.poll();
            if (next == null) {
                return null;
            }
            return new Dispatch(next, ++sequence, Instant.now());
        } finally {
            lock.unlock();
        }
    }

    /** Signal shutdown; waiting workers wake up and get {@code null}. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Remove and return every task still queued, in admission order. */
    public List<Task> drain() {
        lock.lock();
        try {
            List<Task> drained = new ArrayList<>(pending.size());
            Task next;
            while ((next = pending.poll()) != null) {
                drained.add(next);
            }
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
