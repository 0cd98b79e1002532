package com.pulse.telemetry.tasks;

import com.pulse.telemetry.config.TelemetryConfig;
import com.pulse.telemetry.id.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Small in-process task framework running named tasks on a worker pool.
 *
 * Every task gets a generated id and is wrapped with the registered
 * {@link TaskHooks}: before the body, then exactly one of after/on-failure.
 * A hook that throws is logged and never changes the task outcome.
 *
 * Usage:
 * <pre>
 *   try (TaskExecutor tasks = TaskExecutor.create(4, "default", new TaskInstrumentation(client))) {
 *       CompletableFuture&lt;Report&gt; report = tasks.submit("reports.nightly", "reports", this::buildReport);
 *       String pong = tasks.apply("health.ping", null, () -&gt; "pong");   // runs in this thread
 *   }
 * </pre>
 */
public final class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String SUCCESS_STATE = "SUCCESS";

    private final ExecutorService workers;
    private final List<TaskHooks> hooks;
    private final String defaultQueue;

    private TaskExecutor(int workerCount, String defaultQueue, List<TaskHooks> hooks) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0, got " + workerCount);
        }
        this.workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        this.defaultQueue = defaultQueue;
        this.hooks = List.copyOf(hooks);
    }

    public static TaskExecutor create(int workerCount, String defaultQueue, TaskHooks... hooks) {
        return new TaskExecutor(workerCount, defaultQueue, List.of(hooks));
    }

    public static TaskExecutor create(TelemetryConfig.TasksConfig config, TaskHooks... hooks) {
        return create(config.workers(), config.defaultQueue(), hooks);
    }

    // ========================================================================
    // Execution
    // ========================================================================

    /**
     * Run a task asynchronously on the worker pool.
     *
     * @param queue queue name; the executor's default queue when null
     */
    public <T> CompletableFuture<T> submit(String taskName, String queue, Callable<T> body) {
        TaskContext task = newContext(taskName, queue);
        CompletableFuture<T> future = new CompletableFuture<>();
        workers.execute(() -> {
            try {
                future.complete(execute(task, body));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        });
        return future;
    }

    /**
     * Run a task synchronously in the calling thread, with the same hooks as
     * {@link #submit}. The body's exception, if any, is rethrown unchanged.
     */
    public <T> T apply(String taskName, String queue, Callable<T> body) throws Exception {
        return execute(newContext(taskName, queue), body);
    }

    private <T> T execute(TaskContext task, Callable<T> body) throws Exception {
        for (TaskHooks hook : hooks) {
            guard("beforeTask", task, () -> hook.beforeTask(task));
        }

        T result;
        try {
            result = body.call();
        } catch (Throwable t) {
            log.debug("Task {} [{}] failed: {}", task.taskName(), task.taskId(), t.toString());
            for (TaskHooks hook : hooks) {
                guard("onFailure", task, () -> hook.onFailure(task, t));
            }
            throw t;
        }

        for (TaskHooks hook : hooks) {
            guard("afterTask", task, () -> hook.afterTask(task, SUCCESS_STATE, result));
        }
        return result;
    }

    private TaskContext newContext(String taskName, String queue) {
        return TaskContext.of(IdGenerator.getInstance().generateTaskId(), taskName, queue != null ? queue : defaultQueue);
    }

    private static void guard(String hookName, TaskContext task, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Task hook {} failed for task {} [{}]", hookName, task.taskName(), task.taskId(), e);
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Task workers did not finish within 5s, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "task-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
