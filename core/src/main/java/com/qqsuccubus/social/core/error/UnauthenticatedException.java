package com.qqsuccubus.social.core.error;

/**
 * The connection has no resolved user identity.
 */
public class UnauthenticatedException extends RealtimeException {

    public UnauthenticatedException() {
        super("User not authenticated");
    }
}
