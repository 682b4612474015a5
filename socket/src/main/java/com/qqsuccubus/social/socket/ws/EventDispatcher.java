package com.qqsuccubus.social.socket.ws;

import com.fasterxml.jackson.core.type.TypeReference;
import com.qqsuccubus.social.core.error.InvalidRequestException;
import com.qqsuccubus.social.core.error.RealtimeException;
import com.qqsuccubus.social.core.msg.ClientRequests;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.msg.ServerPayloads.ErrorPayload;
import com.qqsuccubus.social.core.util.JsonUtils;
import com.qqsuccubus.social.socket.connection.Connection;
import com.qqsuccubus.social.socket.connection.GroupRegistry;
import com.qqsuccubus.social.socket.connection.IConnectionManager;
import com.qqsuccubus.social.socket.message.DirectMessageRelay;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.presence.PresenceService;
import com.qqsuccubus.social.socket.reaction.ReactionAggregator;
import com.qqsuccubus.social.socket.update.UpdatePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Routes each inbound event to the component that handles it.
 * <p>
 * Failures of {@code sendMessage} are reported to the originating connection as
 * {@code messageError}, failures of {@code createUpdate} and {@code updateReaction} as
 * {@code updateError}. Presence and settings failures have no client event and are only logged.
 * The returned {@code Mono} never fails.
 * </p>
 */
public class EventDispatcher {
	private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

	static final String SEND_FAILED = "Failed to send message";
	static final String CREATE_UPDATE_FAILED = "Failed to create update";
	static final String REACTION_FAILED = "Failed to react to update";
	static final String UNKNOWN_EVENT = "unknown";

	private final PresenceService presenceService;
	private final DirectMessageRelay messageRelay;
	private final ReactionAggregator reactionAggregator;
	private final UpdatePublisher updatePublisher;
	private final GroupRegistry groups;
	private final IConnectionManager connectionManager;
	private final MetricsService metricsService;

	public EventDispatcher(
			PresenceService presenceService,
			DirectMessageRelay messageRelay,
			ReactionAggregator reactionAggregator,
			UpdatePublisher updatePublisher,
			GroupRegistry groups,
			IConnectionManager connectionManager,
			MetricsService metricsService
	) {
		this.presenceService = presenceService;
		this.messageRelay = messageRelay;
		this.reactionAggregator = reactionAggregator;
		this.updatePublisher = updatePublisher;
		this.groups = groups;
		this.connectionManager = connectionManager;
		this.metricsService = metricsService;
	}

	public Mono<Void> dispatch(Connection connection, EventFrame frame) {
		String event = frame.getEvent();
		if (event == null) {
			log.warn("Ignoring frame without event name on connection {}", connection.getConnectionId());
			return Mono.empty();
		}

		long start = System.nanoTime();
		// Client-chosen names must not become meter tags
		String timedEvent = Events.isInbound(event) ? event : UNKNOWN_EVENT;
		return route(connection, event, frame.getData())
				.doFinally(signal -> metricsService.recordEventLatency(timedEvent, start));
	}

	/**
	 * Transport closed. Not reachable from client frames.
	 */
	public Mono<Void> disconnected(Connection connection) {
		return presenceService.disconnect(connection)
				.onErrorResume(err -> logOnly(connection, Events.DISCONNECT, err));
	}

	private Mono<Void> route(Connection connection, String event, Object data) {
		String userId = connection.getUserId().orElse(null);

		switch (event) {
			case Events.JOIN_USER_ROOM -> {
				if (!(data instanceof String group) || group.isBlank()) {
					log.warn("joinUserRoom without a user id on connection {}", connection.getConnectionId());
					return Mono.empty();
				}
				if (connection.isClosed()) {
					log.debug("Ignoring joinUserRoom on closed connection {}", connection.getConnectionId());
					return Mono.empty();
				}
				groups.join(group, connection.getConnectionId());
				if (connection.isClosed()) {
					groups.leaveAll(connection.getConnectionId());
					return Mono.empty();
				}
				log.debug("Connection {} joined group {}", connection.getConnectionId(), group);
				return Mono.empty();
			}
			case Events.SEND_MESSAGE -> {
				return Mono.defer(() -> {
							ClientRequests.SendMessage request = payload(data, ClientRequests.SendMessage.class);
							return messageRelay.send(userId, request.getRecipientId(), request.getText());
						})
						.then()
						.onErrorResume(err -> reportError(connection, Events.MESSAGE_ERROR, SEND_FAILED, err));
			}
			case Events.CREATE_UPDATE -> {
				return Mono.defer(() -> {
							ClientRequests.CreateUpdate request = payload(data, ClientRequests.CreateUpdate.class);
							return updatePublisher.createUpdate(userId, request.getTitle(), request.getDescription());
						})
						.then()
						.onErrorResume(err -> reportError(connection, Events.UPDATE_ERROR, CREATE_UPDATE_FAILED, err));
			}
			case Events.UPDATE_REACTION -> {
				return Mono.defer(() -> {
							ClientRequests.UpdateReaction request = payload(data, ClientRequests.UpdateReaction.class);
							return reactionAggregator.react(userId, request.getUpdateId(), request.getReactionType());
						})
						.then()
						.onErrorResume(err -> reportError(connection, Events.UPDATE_ERROR, REACTION_FAILED, err));
			}
			case Events.USER_LOGIN -> {
				return presenceService.login(connection, asUserId(data))
						.onErrorResume(err -> logOnly(connection, event, err));
			}
			case Events.USER_LOGOUT -> {
				return presenceService.logout(connection, asUserId(data))
						.onErrorResume(err -> logOnly(connection, event, err));
			}
			case Events.UPDATE_SETTINGS -> {
				return Mono.defer(() -> presenceService.updateSettings(connection,
								payload(data, new TypeReference<Map<String, Object>>() {
								})))
						.then()
						.onErrorResume(err -> logOnly(connection, event, err));
			}
			case Events.DISCONNECT -> {
				log.warn("Ignoring client-sent '{}' on connection {}, only a transport close disconnects",
						event, connection.getConnectionId());
				return Mono.empty();
			}
			default -> {
				log.warn("Unknown event '{}' on connection {}", event, connection.getConnectionId());
				return Mono.empty();
			}
		}
	}

	private Mono<Void> reportError(Connection connection, String errorEvent, String fallback, Throwable err) {
		String message = fallback;
		if (err instanceof RealtimeException realtime) {
			log.warn("{} on connection {}: {}", errorEvent, connection.getConnectionId(), err.getMessage());
			if (realtime.isClientVisible()) {
				message = realtime.getMessage();
			}
		} else {
			log.error("{} on connection {}", errorEvent, connection.getConnectionId(), err);
		}
		connectionManager.send(connection.getConnectionId(), EventFrame.of(errorEvent, new ErrorPayload(message)));
		return Mono.empty();
	}

	private Mono<Void> logOnly(Connection connection, String event, Throwable err) {
		if (err instanceof RealtimeException) {
			log.warn("'{}' failed on connection {}: {}", event, connection.getConnectionId(), err.getMessage());
		} else {
			log.error("'{}' failed on connection {}", event, connection.getConnectionId(), err);
		}
		return Mono.empty();
	}

	private static <T> T payload(Object data, Class<T> type) {
		if (data == null) {
			throw new InvalidRequestException("Payload is required");
		}
		try {
			return JsonUtils.convertValue(data, type);
		} catch (IllegalArgumentException e) {
			throw new InvalidRequestException("Malformed payload");
		}
	}

	private static <T> T payload(Object data, TypeReference<T> type) {
		if (data == null) {
			throw new InvalidRequestException("Payload is required");
		}
		try {
			return JsonUtils.convertValue(data, type);
		} catch (IllegalArgumentException e) {
			throw new InvalidRequestException("Malformed payload");
		}
	}

	private static String asUserId(Object data) {
		return data instanceof String userId ? userId : null;
	}
}
