package com.pulse.telemetry.tasks;

/**
 * Lifecycle hooks a task framework drives around every task body.
 *
 * {@link #beforeTask} is called before the body runs; afterwards exactly one of
 * {@link #afterTask} or {@link #onFailure} is called with the same context.
 */
public interface TaskHooks {

    void beforeTask(TaskContext task);

    /**
     * @param state  framework state name, e.g. "SUCCESS"
     * @param result the task's return value, may be null
     */
    void afterTask(TaskContext task, String state, Object result);

    void onFailure(TaskContext task, Throwable error);
}
