package com.qqsuccubus.social.socket.connection;

import com.qqsuccubus.social.core.msg.EventFrame;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the live connections of this node and fans frames out to them.
 * <p>
 * Delivery is fire-and-forget: a frame for a connection that is gone, or whose buffer is full,
 * is dropped and counted, never queued for later.
 * </p>
 */
public interface IConnectionManager {
    /**
     * Opens a new connection and starts tracking it.
     */
    Connection open();

    /**
     * Stops tracking a connection and completes its outbound stream.
     */
    void close(String connectionId);

    Optional<Connection> get(String connectionId);

    /**
     * Sends a frame to one connection.
     *
     * @return true if the frame was queued
     */
    boolean send(String connectionId, EventFrame frame);

    /**
     * Sends a frame to each of the given connections.
     *
     * @return number of connections the frame was queued for
     */
    int sendToAll(Collection<String> connectionIds, EventFrame frame);

    /**
     * Sends a frame to every open connection.
     *
     * @return number of connections the frame was queued for
     */
    int broadcast(EventFrame frame);

    Set<String> getActiveConnectionIds();

    /**
     * Closes every connection (graceful shutdown).
     *
     * @return Mono completing when all connections are closed
     */
    Mono<Void> drainAll();
}
