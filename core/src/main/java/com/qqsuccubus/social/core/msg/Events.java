package com.qqsuccubus.social.core.msg;

import java.util.Set;

/**
 * Event names exchanged with clients. These are part of the client protocol and must not change.
 */
public final class Events {
    private Events() {
    }

    // Client -> server

    /**
     * Payload: user id. Joins the connection to that user's broadcast group.
     */
    public static final String JOIN_USER_ROOM = "joinUserRoom";

    /**
     * Payload: {@code {recipientId, text}}.
     */
    public static final String SEND_MESSAGE = "sendMessage";

    /**
     * Payload: {@code {title, description}}.
     */
    public static final String CREATE_UPDATE = "createUpdate";

    /**
     * Payload: {@code {updateId, reactionType}}. The same name is used for the outbound broadcast.
     */
    public static final String UPDATE_REACTION = "updateReaction";

    /**
     * Payload: user id.
     */
    public static final String USER_LOGIN = "userLogin";

    /**
     * Payload: user id.
     */
    public static final String USER_LOGOUT = "userLogout";

    /**
     * Payload: partial settings object.
     */
    public static final String UPDATE_SETTINGS = "updateSettings";

    /**
     * Synthesized by the transport when a connection closes; never sent by clients.
     */
    public static final String DISCONNECT = "disconnect";

    // Server -> client

    public static final String ONLINE_USERS = "onlineUsers";
    public static final String NEW_MESSAGE = "newMessage";
    public static final String MESSAGE_SENT = "messageSent";
    public static final String NEW_UPDATE = "newUpdate";
    public static final String MESSAGE_ERROR = "messageError";
    public static final String UPDATE_ERROR = "updateError";

    private static final Set<String> INBOUND = Set.of(
        JOIN_USER_ROOM, SEND_MESSAGE, CREATE_UPDATE, UPDATE_REACTION,
        USER_LOGIN, USER_LOGOUT, UPDATE_SETTINGS, DISCONNECT
    );

    /**
     * @return true if {@code event} is one of the client-to-server event names
     */
    public static boolean isInbound(String event) {
        return INBOUND.contains(event);
    }
}
