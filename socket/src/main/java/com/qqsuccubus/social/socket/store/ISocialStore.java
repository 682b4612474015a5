package com.qqsuccubus.social.socket.store;

import com.qqsuccubus.social.core.model.DirectMessage;
import com.qqsuccubus.social.core.model.UpdatePost;
import com.qqsuccubus.social.core.model.UserRecord;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persistent store consumed by the realtime core (Dependency Inversion Principle).
 * <p>
 * Implementations signal failures with
 * {@link com.qqsuccubus.social.core.error.PersistenceException}. Lookups of absent records
 * complete empty rather than failing.
 * </p>
 */
public interface ISocialStore {
    /**
     * Loads the users with the given ids; unknown ids are skipped.
     */
    Mono<List<UserRecord>> findUsersByIdIn(Collection<String> ids);

    /**
     * Loads one user, or completes empty.
     */
    Mono<UserRecord> findUserById(String userId);

    /**
     * Records the user's online flag and last-seen time. No-op for unknown users.
     */
    Mono<Void> setUserOnlineStatus(String userId, boolean online, Instant lastSeen);

    /**
     * Merges the given settings into the user's settings document, creating it if needed.
     *
     * @return the full settings document after the merge
     */
    Mono<Map<String, Object>> upsertUserSettings(String userId, Map<String, Object> partialSettings);

    /**
     * Persists a new direct message.
     */
    Mono<DirectMessage> createMessage(String sender, String recipient, String text);

    /**
     * Loads an update post, or completes empty.
     */
    Mono<UpdatePost> loadUpdateById(String updateId);

    /**
     * Overwrites a stored update post, reactions and counts included.
     */
    Mono<Void> saveUpdate(UpdatePost update);

    /**
     * Persists a new update post with no reactions.
     */
    Mono<UpdatePost> createUpdate(String organizer, String title, String description);

    /**
     * Releases the underlying connection.
     */
    void close();
}
