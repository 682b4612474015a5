package com.qqsuccubus.social.socket.connection;

import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open connections and performs fan-out.
 * <p>
 * Delegates to:
 * - ConnectionFactory: connection creation and buffer sizing
 * </p>
 */
public class ConnectionManager implements IConnectionManager {
	private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

	private final ConnectionFactory connectionFactory;
	private final MetricsService metricsService;

	// Open connections: connectionId -> Connection
	private final Map<String, Connection> activeConnections = new ConcurrentHashMap<>();

	public ConnectionManager(ConnectionFactory connectionFactory, MetricsService metricsService) {
		this.connectionFactory = connectionFactory;
		this.metricsService = metricsService;
	}

	@Override
	public Connection open() {
		Connection connection = connectionFactory.createConnection();
		activeConnections.put(connection.getConnectionId(), connection);
		log.debug("Connection {} opened ({} open)", connection.getConnectionId(), activeConnections.size());
		return connection;
	}

	@Override
	public void close(String connectionId) {
		Connection connection = activeConnections.remove(connectionId);
		if (connection == null) {
			return;
		}
		connection.complete();
		log.debug("Connection {} closed ({} open)", connectionId, activeConnections.size());
	}

	@Override
	public Optional<Connection> get(String connectionId) {
		return Optional.ofNullable(activeConnections.get(connectionId));
	}

	@Override
	public boolean send(String connectionId, EventFrame frame) {
		Connection connection = activeConnections.get(connectionId);
		if (connection == null) {
			// Closed between target resolution and emission
			log.debug("Connection {} gone, dropping '{}'", connectionId, frame.getEvent());
			return false;
		}

		Sinks.EmitResult result = connection.emit(frame);
		if (result.isFailure()) {
			log.warn("Failed to emit '{}' to connection {}: {}", frame.getEvent(), connectionId, result);
			if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
				metricsService.recordDropBufferFull();
			} else {
				metricsService.recordDropClosed();
			}
			return false;
		}
		return true;
	}

	@Override
	public int sendToAll(Collection<String> connectionIds, EventFrame frame) {
		int delivered = 0;
		for (String connectionId : connectionIds) {
			if (send(connectionId, frame)) {
				delivered++;
			}
		}
		return delivered;
	}

	@Override
	public int broadcast(EventFrame frame) {
		return sendToAll(activeConnections.keySet(), frame);
	}

	@Override
	public Set<String> getActiveConnectionIds() {
		return Set.copyOf(activeConnections.keySet());
	}

	@Override
	public Mono<Void> drainAll() {
		log.info("Draining {} open connections", activeConnections.size());
		return Flux.fromIterable(getActiveConnectionIds())
				.doOnNext(this::close)
				.then();
	}

	public int getActiveCount() {
		return activeConnections.size();
	}

}
