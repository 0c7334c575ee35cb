package io.github.drompincen.taskcore.runtime.error;

public class InvalidArgumentException extends TaskCoreException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
