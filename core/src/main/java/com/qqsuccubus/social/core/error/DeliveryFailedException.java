package com.qqsuccubus.social.core.error;

/**
 * A message could not be handed to its recipients. Raised either because it could not be
 * persisted, or because a lookup after persistence failed and fan-out was abandoned.
 */
public class DeliveryFailedException extends RealtimeException {

    public DeliveryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
