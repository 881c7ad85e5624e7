package io.huddle.runtime;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String kind, Object id) {
        this(kind + " #" + id + " not found");
    }

    protected NotFoundException(String message) {
        super(message);
    }
}
