package io.github.drompincen.taskcore.runtime.error;

/** Base of the command-path failures that map to a distinct outcome at the API boundary. */
public abstract class TaskCoreException extends RuntimeException {

    protected TaskCoreException(String message) {
        super(message);
    }

    protected TaskCoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
