package com.qqsuccubus.social.core.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Universal frame for every WebSocket text message, in both directions.
 * <p>
 * Wire form: {@code {"event": "<name>", "data": <payload>}}. The payload shape depends on the
 * event name (see {@link Events}). Inbound payloads arrive as plain JSON trees (maps, strings,
 * numbers) and are converted to typed requests by the dispatcher.
 * </p>
 * <p>
 * <b>Delivery:</b> at-most-once, best effort. Frames for a connection that is gone are dropped.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class EventFrame {
    /**
     * Event name, e.g. "sendMessage" or "onlineUsers".
     */
    String event;

    /**
     * Event payload (application-specific).
     */
    Object data;

    public static EventFrame of(String event, Object data) {
        return new EventFrame(event, data);
    }
}
