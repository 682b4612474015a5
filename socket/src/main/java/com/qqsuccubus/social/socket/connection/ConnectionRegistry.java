package com.qqsuccubus.social.socket.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Presence registry: which users are online, and through which connections.
 * <p>
 * Kept as a bidirectional index so a disconnect resolves its owner in O(1):
 * <ul>
 *   <li>user id -> set of connection ids (an entry exists iff the set is non-empty)</li>
 *   <li>connection id -> owning user id (at most one owner per connection)</li>
 * </ul>
 * All changes to a user's set run inside {@link ConcurrentHashMap#compute}, so concurrent
 * associate/disassociate calls for the same user are atomic with respect to each other.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();
    private final Map<String, String> ownerByConnection = new ConcurrentHashMap<>();

    /**
     * Registers a connection under a user. Idempotent; a connection that belonged to another
     * user is moved.
     *
     * @return true if the user had no connection before this call
     */
    public boolean associate(String userId, String connectionId) {
        String previousOwner = ownerByConnection.put(connectionId, userId);
        if (previousOwner != null && !previousOwner.equals(userId)) {
            log.debug("Connection {} moves from user {} to user {}", connectionId, previousOwner, userId);
            removeFromUser(previousOwner, connectionId);
        }

        AtomicBoolean cameOnline = new AtomicBoolean(false);
        connectionsByUser.compute(userId, (id, connections) -> {
            Set<String> set = connections;
            if (set == null) {
                set = ConcurrentHashMap.newKeySet();
                cameOnline.set(true);
            }
            set.add(connectionId);
            return set;
        });
        return cameOnline.get();
    }

    /**
     * Removes a connection from whichever user owns it.
     *
     * @return the owning user id, only if this removal left the user without connections
     */
    public Optional<String> disassociate(String connectionId) {
        String owner = ownerByConnection.remove(connectionId);
        if (owner == null) {
            return Optional.empty();
        }
        return removeFromUser(owner, connectionId) ? Optional.of(owner) : Optional.empty();
    }

    /**
     * Drops a user's whole entry, whatever the number of connections.
     *
     * @return the connection ids that were registered for the user
     */
    public Set<String> removeUser(String userId) {
        Set<String> removed = connectionsByUser.remove(userId);
        if (removed == null) {
            return Set.of();
        }
        removed.forEach(connectionId -> ownerByConnection.remove(connectionId, userId));
        return Set.copyOf(removed);
    }

    public boolean isOnline(String userId) {
        return connectionsByUser.containsKey(userId);
    }

    public Set<String> onlineUserIds() {
        return Set.copyOf(connectionsByUser.keySet());
    }

    public Set<String> connectionsOf(String userId) {
        Set<String> connections = connectionsByUser.get(userId);
        return connections == null ? Set.of() : Set.copyOf(connections);
    }

    public Optional<String> ownerOf(String connectionId) {
        return Optional.ofNullable(ownerByConnection.get(connectionId));
    }

    public int onlineCount() {
        return connectionsByUser.size();
    }

    /**
     * Forgets everything. Called at shutdown.
     */
    public void clear() {
        connectionsByUser.clear();
        ownerByConnection.clear();
    }

    /**
     * @return true if the user's set became empty and the entry was removed
     */
    private boolean removeFromUser(String userId, String connectionId) {
        AtomicBoolean emptied = new AtomicBoolean(false);
        connectionsByUser.computeIfPresent(userId, (id, connections) -> {
            connections.remove(connectionId);
            if (connections.isEmpty()) {
                emptied.set(true);
                return null;
            }
            return connections;
        });
        return emptied.get();
    }
}
