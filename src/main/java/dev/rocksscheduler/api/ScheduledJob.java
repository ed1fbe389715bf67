package dev.rocksscheduler.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A job waiting for its due timestamp.
 *
 * <p>The argument list is opaque to the scheduler and handed to the ready queue unmodified.
 * On the wire the task identifier is stored under {@code class}.
 *
 * @param queue  destination queue name
 * @param taskId task identifier
 * @param args   ordered task arguments, never null
 */
@JsonPropertyOrder({"queue", "class", "args"})
public record ScheduledJob(
        @JsonProperty("queue") String queue,
        @JsonProperty("class") String taskId,
        @JsonProperty("args") List<Object> args
) {
    public ScheduledJob {
        if (queue == null || queue.trim().isEmpty()) {
            throw new IllegalArgumentException("Jobs must be put in a queue");
        }
        if (taskId == null || taskId.trim().isEmpty()) {
            throw new IllegalArgumentException("Jobs must be given a task identifier");
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static ScheduledJob of(String queue, String taskId, Object... args) {
        return new ScheduledJob(queue, taskId, args == null ? null : Arrays.asList(args));
    }
}
