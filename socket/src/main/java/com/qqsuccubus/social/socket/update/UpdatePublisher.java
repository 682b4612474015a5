package com.qqsuccubus.social.socket.update;

import com.qqsuccubus.social.core.error.UnauthenticatedException;
import com.qqsuccubus.social.core.model.UserProfile;
import com.qqsuccubus.social.core.model.UserRecord;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.msg.ServerPayloads.PublishedUpdate;
import com.qqsuccubus.social.socket.connection.IConnectionManager;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.store.ISocialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * Creates update posts and announces them to everyone as {@code newUpdate}.
 */
public class UpdatePublisher {
    private static final Logger log = LoggerFactory.getLogger(UpdatePublisher.class);

    private final ISocialStore store;
    private final IConnectionManager connectionManager;
    private final MetricsService metricsService;

    public UpdatePublisher(ISocialStore store, IConnectionManager connectionManager, MetricsService metricsService) {
        this.store = store;
        this.connectionManager = connectionManager;
        this.metricsService = metricsService;
    }

    public Mono<PublishedUpdate> createUpdate(@Nullable String organizerId, String title, String description) {
        if (organizerId == null) {
            return Mono.error(new UnauthenticatedException());
        }

        return store.createUpdate(organizerId, title, description)
            .flatMap(update -> store.findUserById(organizerId)
                .map(UserRecord::toProfile)
                .defaultIfEmpty(UserProfile.idOnly(organizerId))
                .map(organizer -> PublishedUpdate.of(update, organizer)))
            .doOnNext(published -> {
                int reached = connectionManager.broadcast(EventFrame.of(Events.NEW_UPDATE, published));
                metricsService.recordUpdateCreated();
                log.info("Update {} created by {}, announced to {} connections", published.getId(), organizerId, reached);
            });
    }
}
