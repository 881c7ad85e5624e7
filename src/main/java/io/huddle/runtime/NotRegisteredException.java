package io.huddle.runtime;

/**
 * The command acts as an instance but this session has no saved identity.
 */
public class NotRegisteredException extends IllegalStateException {
    public NotRegisteredException() {
        super("Not registered. Run 'huddle register' first.");
    }
}
