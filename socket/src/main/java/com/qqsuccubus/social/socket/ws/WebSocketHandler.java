package com.qqsuccubus.social.socket.ws;

import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.util.BytesUtils;
import com.qqsuccubus.social.core.util.JsonUtils;
import com.qqsuccubus.social.socket.config.SocketConfig;
import com.qqsuccubus.social.socket.connection.Connection;
import com.qqsuccubus.social.socket.connection.IConnectionManager;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for client connections.
 * <p>
 * Every frame in both directions is a JSON text frame {@code {"event": ..., "data": ...}}.
 * Inbound frames of one connection are handled strictly one after another. Malformed frames are
 * logged and skipped. When the transport goes away the connection is closed and the dispatcher's
 * disconnect handling runs exactly once.
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final SocketConfig config;
	private final IConnectionManager connectionManager;
	private final EventDispatcher dispatcher;
	private final MetricsService metricsService;

	public WebSocketHandler(
			SocketConfig config,
			IConnectionManager connectionManager,
			EventDispatcher dispatcher,
			MetricsService metricsService
	) {
		this.config = config;
		this.connectionManager = connectionManager;
		this.dispatcher = dispatcher;
		this.metricsService = metricsService;
	}

	/**
	 * Handles WebSocket connection lifecycle.
	 *
	 * @param inbound  WebSocket inbound
	 * @param outbound WebSocket outbound
	 * @return Publisher for the connection
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound) {
		Connection connection = connectionManager.open();
		String connectionId = connection.getConnectionId();

		MDC.put("connectionId", connectionId);
		log.debug("WebSocket connection {} opened", connectionId);

		handleConnectionStateUpdates(inbound, outbound, connection);

		return Mono.when(
						outbound.sendString(sendOutboundMessages(connection)),
						handleInboundMessages(inbound, connection)
				)
				.onErrorResume(err -> {
					log.error("WebSocket error for connection {}", connectionId, err);
					return outbound.sendClose();
				})
				.doFinally(signal -> MDC.remove("connectionId"));
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound,
											  Connection connection) {
		inbound.withConnection(conn -> {
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
			long pingIntervalInMillis = config.getPingInterval() * 1000L;

			conn.onWriteIdle(pingIntervalInMillis, () -> conn.outbound().sendObject(
							Mono.just(new PingWebSocketFrame())
					).then().subscribe())
					.onReadIdle(idleTimeoutInMillis, () -> outbound.sendClose().subscribe())
					.onDispose(() -> {
						log.debug("WebSocket connection {} disposed", connection.getConnectionId());
						connectionManager.close(connection.getConnectionId());
						dispatcher.disconnected(connection).subscribe();
					});
		});
	}

	private Flux<String> sendOutboundMessages(Connection connection) {
		return connection.getOutboundFlux()
				.map(JsonUtils::writeValueAsString)
				.doOnNext(message -> metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(message)));
	}

	private Mono<Void> handleInboundMessages(WebsocketInbound inbound, Connection connection) {
		return inbound.aggregateFrames(config.getMaxFramePayload())
				.receive()
				.asString()
				.onBackpressureBuffer(config.getPerConnBufferSize())
				.concatMap(json -> handleInboundMessage(connection, json))
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", connection.getConnectionId(), err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then();
	}

	private Mono<Void> handleInboundMessage(Connection connection, String json) {
		metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(json));

		EventFrame frame;
		try {
			frame = JsonUtils.readValue(json, EventFrame.class);
		} catch (IllegalArgumentException e) {
			log.warn("Malformed frame from connection {}: {}", connection.getConnectionId(), e.getMessage());
			return Mono.empty();
		}

		if (frame == null) {
			log.warn("Empty frame from connection {}", connection.getConnectionId());
			return Mono.empty();
		}

		log.debug("Processing '{}' from connection {}", frame.getEvent(), connection.getConnectionId());
		return dispatcher.dispatch(connection, frame);
	}
}
