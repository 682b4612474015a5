package com.qqsuccubus.social.socket;

import com.qqsuccubus.social.core.util.KeyedSequencer;
import com.qqsuccubus.social.socket.config.SocketConfig;
import com.qqsuccubus.social.socket.connection.ConnectionFactory;
import com.qqsuccubus.social.socket.connection.ConnectionManager;
import com.qqsuccubus.social.socket.connection.ConnectionRegistry;
import com.qqsuccubus.social.socket.connection.GroupRegistry;
import com.qqsuccubus.social.socket.http.HttpServer;
import com.qqsuccubus.social.socket.message.DirectMessageRelay;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.social.socket.presence.PresenceBroadcaster;
import com.qqsuccubus.social.socket.presence.PresenceService;
import com.qqsuccubus.social.socket.reaction.ReactionAggregator;
import com.qqsuccubus.social.socket.store.RedisSocialStore;
import com.qqsuccubus.social.socket.update.UpdatePublisher;
import com.qqsuccubus.social.socket.ws.EventDispatcher;
import com.qqsuccubus.social.socket.ws.WebSocketHandler;
import com.qqsuccubus.social.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the realtime node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at the configured path (default /ws)</li>
 *   <li>Track online users and broadcast privacy-filtered presence</li>
 *   <li>Relay direct messages, publish updates and aggregate reactions</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting realtime node: {}", config.getNodeId());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  WebSocket path: {}", config.getWsPath());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        RedisSocialStore store = new RedisSocialStore(config);

        ConnectionRegistry registry = new ConnectionRegistry();
        GroupRegistry groups = new GroupRegistry();
        KeyedSequencer sequencer = new KeyedSequencer();
        ConnectionManager connectionManager = new ConnectionManager(new ConnectionFactory(config), metricsService);
        metricsService.bindGauges(connectionManager::getActiveCount, registry::onlineCount);

        PresenceBroadcaster broadcaster = new PresenceBroadcaster(
            registry, store, connectionManager, sequencer, metricsService
        );
        PresenceService presenceService = new PresenceService(
            registry, groups, store, broadcaster, sequencer, Clock.systemUTC()
        );
        DirectMessageRelay messageRelay = new DirectMessageRelay(
            store, registry, groups, connectionManager, metricsService, config
        );
        ReactionAggregator reactionAggregator = new ReactionAggregator(
            store, connectionManager, sequencer, metricsService
        );
        UpdatePublisher updatePublisher = new UpdatePublisher(store, connectionManager, metricsService);

        EventDispatcher dispatcher = new EventDispatcher(
            presenceService,
            messageRelay,
            reactionAggregator,
            updatePublisher,
            groups,
            connectionManager,
            metricsService
        );
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config, new WebSocketHandler(config, connectionManager, dispatcher, metricsService)
        );

        HttpServer httpServer = new HttpServer(config, upgradeHandler, metricsExporter);
        httpServer.start();

        log.info("Realtime node {} is ready", config.getNodeId());

        handleShutdown(config, upgradeHandler, connectionManager, httpServer, registry, groups, store);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config,
                                       WebSocketUpgradeHandler upgradeHandler,
                                       ConnectionManager connectionManager,
                                       HttpServer httpServer,
                                       ConnectionRegistry registry,
                                       GroupRegistry groups,
                                       RedisSocialStore store) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            upgradeHandler.stopAccepting();

            // Close client connections before the server goes away
            connectionManager.drainAll().block(Duration.ofSeconds(30));

            httpServer.stop();

            registry.clear();
            groups.clear();

            store.close();

            log.info("Shutdown complete");
        }));
    }
}
