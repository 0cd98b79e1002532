package com.pulse.telemetry.tasks;

import com.pulse.telemetry.observability.ObservabilityClient;

/**
 * Maps task lifecycle hooks onto the collector's task API.
 *
 * A task id that never went through {@link #beforeTask} (instrumentation
 * attached mid-flight) completes as a silent no-op.
 */
public final class TaskInstrumentation implements TaskHooks {

    static final String DEFAULT_STATE = "SUCCESS";

    private final ObservabilityClient client;

    public TaskInstrumentation(ObservabilityClient client) {
        this.client = client;
    }

    @Override
    public void beforeTask(TaskContext task) {
        client.beginTask(task.taskId(), task.taskName(), task.queue().orElse(null));
    }

    @Override
    public void afterTask(TaskContext task, String state, Object result) {
        String status = state != null ? state : DEFAULT_STATE;
        client.completeTask(task.taskId(), status, result != null ? result : task.taskName(), null);
    }

    @Override
    public void onFailure(TaskContext task, Throwable error) {
        client.failTask(task.taskId(), error);
    }
}
