package com.phillippitts.alarmblock.testutil;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * TaskScheduler that never runs anything on its own. One-shot tasks are recorded with their due
 * instant and a mock future; the test runs them explicitly.
 */
public class ManualTaskScheduler {

    /**
     * One recorded {@code schedule(Runnable, Instant)} call.
     */
    public record ScheduledTask(Runnable task, Instant due, ScheduledFuture<?> future) {
        public void run() {
            task.run();
        }
    }

    private final TaskScheduler scheduler = mock(TaskScheduler.class);
    private final List<ScheduledTask> tasks = new CopyOnWriteArrayList<>();
    private volatile boolean rejecting;

    public ManualTaskScheduler() {
        doAnswer(invocation -> {
            if (rejecting) {
                throw new TaskRejectedException("scheduler shut down");
            }
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            tasks.add(new ScheduledTask(invocation.getArgument(0), invocation.getArgument(1), future));
            return future;
        }).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public List<ScheduledTask> tasks() {
        return List.copyOf(tasks);
    }

    public ScheduledTask last() {
        return tasks.get(tasks.size() - 1);
    }

    public void setRejecting(boolean rejecting) {
        this.rejecting = rejecting;
    }
}
