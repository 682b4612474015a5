package com.qqsuccubus.social.socket.http;

import com.qqsuccubus.social.socket.config.SocketConfig;
import com.qqsuccubus.social.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.social.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness fails once shutdown has started
                .get("/readyz", (req, res) -> {
                    if (!upgradeHandler.isAccepting()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get(config.getWsPath(), upgradeHandler::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {} (WebSocket path {})", server.port(), config.getWsPath());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
