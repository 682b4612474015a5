package com.qqsuccubus.social.socket.presence;

import com.qqsuccubus.social.core.error.InvalidRequestException;
import com.qqsuccubus.social.core.error.UnauthenticatedException;
import com.qqsuccubus.social.core.model.UserRecord;
import com.qqsuccubus.social.core.util.KeyedSequencer;
import com.qqsuccubus.social.socket.connection.Connection;
import com.qqsuccubus.social.socket.connection.ConnectionRegistry;
import com.qqsuccubus.social.socket.connection.GroupRegistry;
import com.qqsuccubus.social.socket.store.ISocialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Login, logout, disconnect and settings handling.
 * <p>
 * Each handler mutates the registry synchronously, then persists the user's online status and
 * refreshes presence. Status writes for one user run one at a time and always write the
 * registry's state at the moment the write starts, so the stored flag converges on the
 * in-memory truth however logins and disconnects interleave.
 * </p>
 */
public class PresenceService {
	private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

	private final ConnectionRegistry registry;
	private final GroupRegistry groups;
	private final ISocialStore store;
	private final PresenceBroadcaster broadcaster;
	private final KeyedSequencer sequencer;
	private final Clock clock;

	public PresenceService(
			ConnectionRegistry registry,
			GroupRegistry groups,
			ISocialStore store,
			PresenceBroadcaster broadcaster,
			KeyedSequencer sequencer,
			Clock clock
	) {
		this.registry = registry;
		this.groups = groups;
		this.store = store;
		this.broadcaster = broadcaster;
		this.sequencer = sequencer;
		this.clock = clock;
	}

	/**
	 * Binds {@code userId} to the connection and marks the user online.
	 */
	public Mono<Void> login(Connection connection, @Nullable String userId) {
		if (userId == null || userId.isBlank()) {
			return Mono.error(new InvalidRequestException("userId is required"));
		}

		String connectionId = connection.getConnectionId();
		if (connection.isClosed()) {
			log.debug("Ignoring login of {} on closed connection {}", userId, connectionId);
			return Mono.empty();
		}

		Optional<String> previous = connection.getUserId().filter(id -> !id.equals(userId));
		previous.ifPresent(id -> groups.leave(id, connectionId));

		connection.authenticate(userId);
		boolean cameOnline = registry.associate(userId, connectionId);
		groups.join(userId, connectionId);

		// Closed while associating: the disconnect may already have run and found nothing
		if (connection.isClosed()) {
			log.debug("Connection {} closed during login of {}, rolling back", connectionId, userId);
			return disconnect(connection);
		}
		log.info("User {} logged in on connection {} (first connection: {})", userId, connectionId, cameOnline);

		Mono<Void> previousStatus = previous
			.filter(id -> !registry.isOnline(id))
			.map(this::writeStatus)
			.orElse(Mono.empty());

		return previousStatus
			.then(writeStatus(userId))
			.then(broadcaster.refreshAndPublish());
	}

	/**
	 * Takes the user offline on every connection, not only the calling one.
	 */
	public Mono<Void> logout(Connection connection, @Nullable String userId) {
		String target = userId != null && !userId.isBlank() ? userId : connection.getUserId().orElse(null);
		if (target == null) {
			return Mono.error(new InvalidRequestException("userId is required"));
		}

		Set<String> dropped = registry.removeUser(target);
		connection.clearUser(target);
		log.info("User {} logged out, {} connections detached", target, dropped.size());

		return writeStatus(target).then(broadcaster.refreshAndPublish());
	}

	/**
	 * Cleans up after a closed transport. Presence is only refreshed if this was the user's
	 * last connection.
	 */
	public Mono<Void> disconnect(Connection connection) {
		String connectionId = connection.getConnectionId();
		groups.leaveAll(connectionId);

		Optional<String> wentOffline = registry.disassociate(connectionId);
		if (wentOffline.isEmpty()) {
			log.debug("Connection {} disconnected, owner still online or never logged in", connectionId);
			return Mono.empty();
		}

		String userId = wentOffline.get();
		log.info("User {} went offline (connection {} closed)", userId, connectionId);
		return writeStatus(userId).then(broadcaster.refreshAndPublish());
	}

	/**
	 * Merges settings for the connection's user. Presence is refreshed only when the change
	 * carries a boolean {@code showOnlineStatus}.
	 */
	public Mono<Map<String, Object>> updateSettings(Connection connection, @Nullable Map<String, Object> partial) {
		String userId = connection.getUserId().orElse(null);
		if (userId == null) {
			return Mono.error(new UnauthenticatedException());
		}
		if (partial == null) {
			return Mono.error(new InvalidRequestException("Settings payload is required"));
		}

		boolean visibilityChanged = partial.get(UserRecord.F_SHOW_ONLINE_STATUS) instanceof Boolean;

		return store.upsertUserSettings(userId, partial)
			.flatMap(settings -> {
				log.debug("Settings of user {} updated: {}", userId, partial.keySet());
				return visibilityChanged
					? broadcaster.refreshAndPublish().thenReturn(settings)
					: Mono.just(settings);
			});
	}

	private Mono<Void> writeStatus(String userId) {
		return sequencer.run("presence:" + userId, () -> {
				boolean online = registry.isOnline(userId);
				return store.setUserOnlineStatus(userId, online, clock.instant());
			})
			.onErrorResume(err -> {
				log.error("Failed to persist online status of user {}", userId, err);
				return Mono.empty();
			});
	}
}
