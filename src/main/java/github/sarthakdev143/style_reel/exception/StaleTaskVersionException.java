package github.sarthakdev143.style_reel.exception;

public class StaleTaskVersionException extends RuntimeException {

    public StaleTaskVersionException(String taskId, long expectedVersion, long actualVersion) {
        super("Task " + taskId + " is at version " + actualVersion + ", expected " + expectedVersion + ".");
    }
}
