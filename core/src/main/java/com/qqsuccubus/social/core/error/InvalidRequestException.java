package com.qqsuccubus.social.core.error;

/**
 * A known event arrived with a payload that cannot be acted on.
 */
public class InvalidRequestException extends RealtimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
