package com.qqsuccubus.social.core.redis;

/**
 * Redis keyspace of the social store.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (user:, settings:, message:, update:)</li>
 *   <li>Hashes for flat documents the core patches field by field, strings (JSON) for nested ones</li>
 *   <li>Lists keep insertion order for feeds and conversations</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * User document: {@code user:{userId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> id, username, profilePicture, avatar, isVerified, isPremium,
     * showOnlineStatus, isOnline, lastSeen (epoch millis)
     * </p>
     *
     * @param userId User identifier
     * @return Redis key
     */
    public static String user(String userId) {
        return "user:" + userId;
    }

    /**
     * User settings: {@code settings:{userId}}
     * <p>
     * <b>Type:</b> Hash, one field per setting, each value JSON-encoded.
     * </p>
     */
    public static String settings(String userId) {
        return "settings:" + userId;
    }

    /**
     * Direct message: {@code message:{messageId}}, a JSON string.
     */
    public static String message(String messageId) {
        return "message:" + messageId;
    }

    /**
     * Conversation index: {@code conv:{a}:{b}} with the two user ids in lexical order.
     * <p>
     * <b>Type:</b> List of message ids, oldest first.
     * </p>
     */
    public static String conversation(String userA, String userB) {
        return userA.compareTo(userB) <= 0
            ? "conv:" + userA + ":" + userB
            : "conv:" + userB + ":" + userA;
    }

    /**
     * Update post: {@code update:{updateId}}, a JSON string including its reactions.
     */
    public static String update(String updateId) {
        return "update:" + updateId;
    }

    /**
     * Update feed: list of update ids, newest first.
     */
    public static String updatesFeed() {
        return "updates";
    }

}
