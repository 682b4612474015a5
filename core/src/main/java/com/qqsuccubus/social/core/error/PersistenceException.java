package com.qqsuccubus.social.core.error;

/**
 * A store operation failed. The detail is for logs only.
 */
public class PersistenceException extends RealtimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isClientVisible() {
        return false;
    }
}
