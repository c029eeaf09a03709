package de.bsommerfeld.widgetd.core.lifecycle;

/**
 * Wraps the failure of a {@link SupervisedTask} together with its name.
 */
public class SupervisedTaskException extends RuntimeException {

    private final String taskName;

    public SupervisedTaskException(String taskName, Throwable cause) {
        super("Task '" + taskName + "' failed: " + cause.getMessage(), cause);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
