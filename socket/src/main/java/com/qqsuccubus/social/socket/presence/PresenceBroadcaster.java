package com.qqsuccubus.social.socket.presence;

import com.qqsuccubus.social.core.model.UserProfile;
import com.qqsuccubus.social.core.model.UserRecord;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.util.KeyedSequencer;
import com.qqsuccubus.social.socket.connection.ConnectionRegistry;
import com.qqsuccubus.social.socket.connection.IConnectionManager;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.store.ISocialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Publishes the list of online users to every connection.
 * <p>
 * A snapshot is the registry's online users, minus those whose stored {@code showOnlineStatus}
 * is false. Snapshots are never cached: each publish reads the store again. Publishes are
 * serialized so the last snapshot sent is always computed from the latest registry state.
 * </p>
 */
public class PresenceBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(PresenceBroadcaster.class);

    private static final String SEQUENCE_KEY = "presence";

    private final ConnectionRegistry registry;
    private final ISocialStore store;
    private final IConnectionManager connectionManager;
    private final KeyedSequencer sequencer;
    private final MetricsService metricsService;

    public PresenceBroadcaster(
        ConnectionRegistry registry,
        ISocialStore store,
        IConnectionManager connectionManager,
        KeyedSequencer sequencer,
        MetricsService metricsService
    ) {
        this.registry = registry;
        this.store = store;
        this.connectionManager = connectionManager;
        this.sequencer = sequencer;
        this.metricsService = metricsService;
    }

    /**
     * Computes the current visible online users.
     */
    public Mono<List<UserProfile>> snapshot() {
        Set<String> online = registry.onlineUserIds();
        if (online.isEmpty()) {
            return Mono.just(List.of());
        }
        return store.findUsersByIdIn(online)
            .map(users -> users.stream()
                .filter(UserRecord::isShowOnlineStatus)
                .map(UserRecord::toProfile)
                .collect(Collectors.toList()));
    }

    /**
     * Recomputes the snapshot and broadcasts it as {@code onlineUsers}.
     * Never fails: a store error skips this broadcast.
     */
    public Mono<Void> refreshAndPublish() {
        return sequencer.run(SEQUENCE_KEY, () -> snapshot()
            .doOnNext(users -> {
                int reached = connectionManager.broadcast(EventFrame.of(Events.ONLINE_USERS, users));
                metricsService.recordPresencePublished();
                log.debug("Published {} online users to {} connections", users.size(), reached);
            })
            .then()
            .onErrorResume(err -> {
                log.warn("Skipping presence broadcast, could not load online users: {}", err.getMessage());
                metricsService.recordPresenceSkipped();
                return Mono.empty();
            }));
    }
}
