/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@Component
@Slf4j
public class TaskExecutorUtil {
    public static final String SCOPE_MDC_KEY = "scope";
    private static final long MAX_JOIN_MARGIN_NANOS = TimeUnit.SECONDS.toNanos(1);
    /**
     * The time by which the parent of the task running on this thread stops waiting for it.
     */
    private static final ThreadLocal<Long> TASK_DEADLINE = new ThreadLocal<>();
    private final AWSApiCallRateLimiter rateLimiter;
    private final ScanCancellation scanCancellation;
    private final long taskTimeoutSeconds;

    public TaskExecutorUtil(AWSApiCallRateLimiter rateLimiter, ScanCancellation scanCancellation,
                            ScanConfigProvider scanConfigProvider) {
        this(rateLimiter, scanCancellation, scanConfigProvider.getScanConfig().getTaskTimeoutSeconds());
    }

    @VisibleForTesting
    TaskExecutorUtil(AWSApiCallRateLimiter rateLimiter, ScanCancellation scanCancellation, long taskTimeoutSeconds) {
        this.rateLimiter = rateLimiter;
        this.scanCancellation = scanCancellation;
        this.taskTimeoutSeconds = taskTimeoutSeconds;
    }

    public <T> Future<T> executeScopeTask(TaskThreadPool pool, ScopeTask<T> task) {
        long deadline = joinDeadline();
        return pool.getExecutorService().submit(() -> {
            String previousScope = MDC.get(SCOPE_MDC_KEY);
            Long previousDeadline = TASK_DEADLINE.get();
            MDC.put(SCOPE_MDC_KEY, task.getScope());
            TASK_DEADLINE.set(deadline);
            try {
                return rateLimiter.call(task);
            } catch (Exception e) {
                log.error("Failed to execute task for scope:" + task.getScope(), e);
                return task.onError(e);
            } finally {
                if (previousScope != null) {
                    MDC.put(SCOPE_MDC_KEY, previousScope);
                } else {
                    MDC.remove(SCOPE_MDC_KEY);
                }
                if (previousDeadline != null) {
                    TASK_DEADLINE.set(previousDeadline);
                } else {
                    TASK_DEADLINE.remove();
                }
            }
        });
    }

    /**
     * Submits all the tasks to the pool and waits for every one of them. The results are returned in the order of
     * the tasks. A task that fails, times out or is cancelled contributes the value of its
     * {@link ScopeTask#onError(Throwable)}.
     */
    public <T> List<T> invokeAll(TaskThreadPool pool, List<? extends ScopeTask<T>> tasks) {
        List<Future<T>> futures = tasks.stream()
                .map(task -> executeScopeTask(pool, task))
                .collect(Collectors.toList());
        return awaitAll(tasks, futures);
    }

    /**
     * Waits for the futures of the given tasks, all within a single timeout. When called from within a scope task the
     * wait ends before the parent of that task stops waiting for it, so that the parent receives a result instead of
     * interrupting the task.
     * <p>
     * An interrupt cancels the futures that are still pending. It does not cancel the scan, only the shutdown hook of
     * {@link InventoryRunner} does.
     */
    public <T> List<T> awaitAll(List<? extends ScopeTask<T>> tasks, List<Future<T>> futures) {
        long deadline = joinDeadline();
        List<T> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<T> future = futures.get(i);
            ScopeTask<T> task = tasks.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {}, abandoning {} pending tasks", task.getScope(),
                        futures.size() - i);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    results.add(tasks.get(j).onError(interruption()));
                }
                break;
            } catch (ExecutionException e) {
                log.error("Task for scope {} failed", task.getScope(), e.getCause());
                results.add(task.onError(e.getCause()));
            } catch (TimeoutException e) {
                log.error("Task for scope {} did not complete within {} seconds", task.getScope(),
                        taskTimeoutSeconds);
                future.cancel(true);
                results.add(task.onError(e));
            } catch (CancellationException e) {
                results.add(task.onError(e));
            }
        }
        return results;
    }

    /**
     * A task abandoned on an interrupt is reported as cancelled only when the scan is being cancelled. Otherwise the
     * interrupt comes from a parent that timed out.
     */
    private Throwable interruption() {
        if (scanCancellation.isCancelled()) {
            return new CancellationException("Scan cancelled");
        }
        return new TimeoutException("Parent scope timed out");
    }

    private long joinDeadline() {
        long timeoutNanos = TimeUnit.SECONDS.toNanos(taskTimeoutSeconds);
        long deadline = System.nanoTime() + timeoutNanos;
        Long parentDeadline = TASK_DEADLINE.get();
        if (parentDeadline == null) {
            return deadline;
        }
        long margin = Math.min(MAX_JOIN_MARGIN_NANOS, timeoutNanos / 20);
        return Math.min(deadline, parentDeadline - margin);
    }
}
