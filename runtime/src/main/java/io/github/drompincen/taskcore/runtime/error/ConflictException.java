package io.github.drompincen.taskcore.runtime.error;

public class ConflictException extends TaskCoreException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
