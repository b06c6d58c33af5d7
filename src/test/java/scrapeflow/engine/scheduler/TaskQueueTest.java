package scrapeflow.engine.scheduler;

import org.junit.jupiter.api.Test;
import scrapeflow.engine.model.Task;
import scrapeflow.engine.scheduler.TaskQueue.Dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    private static Task task(int id, int priority) {
        return Task.builder().id(id).priority(priority).type("news").build();
    }

    @Test
    void takesHighestPriorityFirstAndTiesByAscendingId() throws InterruptedException {
        TaskQueue queue = new TaskQueue();
        queue.addAll(List.of(task(0, 1), task(1, 5), task(2, 3), task(3, 5), task(4, 1)));
        queue.close();

        List<Integer> order = new ArrayList<>();
        List<Long> sequences = new ArrayList<>();
        Dispatch dispatch;
        while ((dispatch = queue.take()) != null) {
            order.add(dispatch.task().id());
            sequences.add(dispatch.sequence());
        }

        assertEquals(List.of(1, 3, 2, 0, 4), order);
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), sequences);
    }

    @Test
    void closedAndEmptyQueueReturnsNull() throws InterruptedException {
        TaskQueue queue = new TaskQueue();
        queue.close();

        assertNull(queue.take());
        assertTrue(queue.isClosed());
    }

    @Test
    void closeWakesBlockedTaker() throws InterruptedException {
        TaskQueue queue = new TaskQueue();
        AtomicReference<Dispatch> taken = new AtomicReference<>(new Dispatch(task(99, 0), 0, null));

        Thread taker = new Thread(() -> {
            try {
                taken.set(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        taker.start();
        Thread.sleep(100);
        assertTrue(taker.isAlive(), "taker should block on an empty open queue");

        queue.close();
        taker.join(2000);

        assertFalse(taker.isAlive());
        assertNull(taken.get());
    }

    @Test
    void addingToClosedQueueFails() {
        TaskQueue queue = new TaskQueue();
        queue.close();

        assertThrows(IllegalStateException.class, () -> queue.addAll(List.of(task(1, 1))));
    }

    @Test
    void drainRemovesRemainingInOrder() {
        TaskQueue queue = new TaskQueue();
        queue.addAll(List.of(task(0, 1), task(1, 2)));

        List<Task> drained = queue.drain();

        assertEquals(List.of(1, 0), drained.stream().map(Task::id).toList());
        assertEquals(0, queue.size());
    }
}
