package github.sarthakdev143.style_reel.exception;

import github.sarthakdev143.style_reel.model.TaskStatus;

public class InvalidTaskTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTaskTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to + ".");
        this.from = from;
        this.to = to;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
