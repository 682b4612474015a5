package com.qqsuccubus.social.socket.ws;

import com.qqsuccubus.social.socket.config.SocketConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Upgrades HTTP requests on the WebSocket path. Identity is not taken from the request: a
 * connection is anonymous until it sends {@code userLogin}.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final WebsocketServerSpec serverSpec;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public WebSocketUpgradeHandler(SocketConfig config, WebSocketHandler wsHandler) {
        this.wsHandler = wsHandler;
        this.serverSpec = WebsocketServerSpec.builder()
            .maxFramePayloadLength(config.getMaxFramePayload())
            .build();
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (!accepting.get()) {
            log.warn("Rejecting new WebSocket connection from {}, node is shutting down", req.remoteAddress());
            return res.status(503)
                .sendString(Mono.just("Service unavailable - shutting down"))
                .then();
        }

        return res.sendWebsocket(wsHandler::handle, serverSpec);
    }

    /**
     * Stops accepting upgrades. Open connections are unaffected.
     */
    public void stopAccepting() {
        accepting.set(false);
    }

    public boolean isAccepting() {
        return accepting.get();
    }
}
