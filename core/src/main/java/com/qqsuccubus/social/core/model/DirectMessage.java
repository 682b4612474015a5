package com.qqsuccubus.social.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Point-to-point message between two users, persisted before it is delivered.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DirectMessage {
    String id;

    /**
     * Sending user id.
     */
    String sender;

    /**
     * Receiving user id.
     */
    String recipient;

    String text;

    Instant createdAt;
}
