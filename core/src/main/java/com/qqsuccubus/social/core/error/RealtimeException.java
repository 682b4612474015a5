package com.qqsuccubus.social.core.error;

/**
 * Base of the failures a realtime handler can signal.
 * <p>
 * Handlers fail their {@code Mono} with one of the subclasses; the dispatcher turns it into a
 * targeted error event for the originating connection. When {@link #isClientVisible()} is false
 * the client receives the handler's generic failure text instead of {@link #getMessage()}.
 * </p>
 */
public abstract class RealtimeException extends RuntimeException {

    protected RealtimeException(String message) {
        super(message);
    }

    protected RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isClientVisible() {
        return true;
    }
}
