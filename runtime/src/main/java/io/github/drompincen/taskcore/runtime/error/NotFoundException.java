package io.github.drompincen.taskcore.runtime.error;

public class NotFoundException extends TaskCoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, String id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}
