package io.huddle.runtime;

/**
 * A claim matched no pending row. The task may not exist, may already be claimed, or another instance
 * may have won the race; the caller cannot tell these apart and does not need to.
 */
public class TaskNotAvailableException extends NotFoundException {
    public TaskNotAvailableException(long taskId) {
        super("Task #" + taskId + " not available (already claimed or doesn't exist)");
    }
}
