package com.qqsuccubus.social.core.error;

public class NotFoundException extends RealtimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
