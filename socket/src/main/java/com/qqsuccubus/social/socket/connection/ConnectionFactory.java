package com.qqsuccubus.social.socket.connection;

import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Creates {@link Connection} objects with a bounded outbound buffer.
 */
public class ConnectionFactory {
    private final SocketConfig config;

    public ConnectionFactory(SocketConfig config) {
        this.config = config;
    }

    /**
     * Creates a connection with a fresh random handle.
     *
     * @return Connection instance
     */
    public Connection createConnection() {
        // Frames emitted before the socket subscribes are buffered, up to the same limit
        Sinks.Many<EventFrame> sink = Sinks.many().unicast().onBackpressureBuffer(
            new ArrayBlockingQueue<>(config.getPerConnBufferSize())
        );

        return new Connection(UUID.randomUUID().toString(), sink);
    }

}
