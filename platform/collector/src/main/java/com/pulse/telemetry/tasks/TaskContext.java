package com.pulse.telemetry.tasks;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of one task execution, stable across its begin and end hooks.
 */
public record TaskContext(String taskId, String taskName, Optional<String> queue) {

    public TaskContext {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(taskName, "taskName");
        queue = queue != null ? queue : Optional.empty();
    }

    public static TaskContext of(String taskId, String taskName, String queue) {
        return new TaskContext(taskId, taskName, Optional.ofNullable(queue));
    }
}
