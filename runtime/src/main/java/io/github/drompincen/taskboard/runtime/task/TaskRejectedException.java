package io.github.drompincen.taskboard.runtime.task;

/**
 * A write the board rules do not allow, such as a status outside the team's vocabulary.
 */
public class TaskRejectedException extends RuntimeException {

    public TaskRejectedException(String message) {
        super(message);
    }
}
