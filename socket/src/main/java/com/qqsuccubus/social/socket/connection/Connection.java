package com.qqsuccubus.social.socket.connection;

import com.qqsuccubus.social.core.msg.EventFrame;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live WebSocket connection.
 * <p>
 * Holds the outbound frame queue and the user identity resolved for this connection, if any.
 * The identity is set by {@code userLogin} and is what authorizes messages, updates and reactions.
 * </p>
 */
public class Connection {
    @Getter
    private final String connectionId;
    private final Sinks.Many<EventFrame> sink;
    private final AtomicReference<String> userId = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Connection(String connectionId, Sinks.Many<EventFrame> sink) {
        this.connectionId = connectionId;
        this.sink = sink;
    }

    public Optional<String> getUserId() {
        return Optional.ofNullable(userId.get());
    }

    public void authenticate(String userId) {
        this.userId.set(userId);
    }

    /**
     * Clears the identity if it still belongs to {@code expectedUserId}.
     */
    public void clearUser(String expectedUserId) {
        userId.compareAndSet(expectedUserId, null);
    }

    /**
     * Queues a frame for this connection. Callers on different threads are serialized here
     * because the sink accepts a single producer at a time.
     */
    public synchronized Sinks.EmitResult emit(EventFrame frame) {
        return sink.tryEmitNext(frame);
    }

    /**
     * Marks the connection closed and completes its outbound stream. Frames still queued
     * inbound must not register a closed connection anywhere.
     */
    public synchronized void complete() {
        closed.set(true);
        sink.tryEmitComplete();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Flux<EventFrame> getOutboundFlux() {
        return sink.asFlux();
    }
}
