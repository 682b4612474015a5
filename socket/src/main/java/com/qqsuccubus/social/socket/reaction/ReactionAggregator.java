package com.qqsuccubus.social.socket.reaction;

import com.qqsuccubus.social.core.error.InvalidRequestException;
import com.qqsuccubus.social.core.error.NotFoundException;
import com.qqsuccubus.social.core.error.UnauthenticatedException;
import com.qqsuccubus.social.core.model.Reaction;
import com.qqsuccubus.social.core.model.ReactionType;
import com.qqsuccubus.social.core.model.UpdatePost;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.util.KeyedSequencer;
import com.qqsuccubus.social.socket.connection.IConnectionManager;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.store.ISocialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Applies reaction toggles to update posts.
 * <p>
 * Load, transition and save of one update run as a single step per update id, so concurrent
 * reactions on the same update are applied one after another and none is lost. Different
 * updates are processed independently. The saved update is broadcast to every connection as
 * {@code updateReaction}.
 * </p>
 */
public class ReactionAggregator {
    private static final Logger log = LoggerFactory.getLogger(ReactionAggregator.class);

    private final ISocialStore store;
    private final IConnectionManager connectionManager;
    private final KeyedSequencer sequencer;
    private final MetricsService metricsService;

    public ReactionAggregator(
        ISocialStore store,
        IConnectionManager connectionManager,
        KeyedSequencer sequencer,
        MetricsService metricsService
    ) {
        this.store = store;
        this.connectionManager = connectionManager;
        this.sequencer = sequencer;
        this.metricsService = metricsService;
    }

    /**
     * Toggles {@code userId}'s reaction on an update.
     *
     * @param userId       identity of the reacting connection, null if it never logged in
     * @param updateId     update to react to
     * @param reactionType wire name of the requested reaction
     * @return the update after the change
     */
    public Mono<UpdatePost> react(@Nullable String userId, @Nullable String updateId, @Nullable String reactionType) {
        if (userId == null) {
            return Mono.error(new UnauthenticatedException());
        }
        if (updateId == null || updateId.isBlank()) {
            return Mono.error(new InvalidRequestException("updateId is required"));
        }
        ReactionType requested = ReactionType.parse(reactionType).orElse(null);
        if (requested == null) {
            return Mono.error(new InvalidRequestException("Unknown reaction type: " + reactionType));
        }

        return sequencer.run("update:" + updateId, () -> store.loadUpdateById(updateId)
            .switchIfEmpty(Mono.error(() -> new NotFoundException("Update not found")))
            .flatMap(update -> {
                ReactionType current = update.findReaction(userId).map(Reaction::getType).orElse(null);
                ReactionTransition transition = ReactionTransition.of(current, requested);
                transition.applyTo(update, userId);

                return store.saveUpdate(update)
                    .then(Mono.fromSupplier(() -> {
                        int reached = connectionManager.broadcast(EventFrame.of(Events.UPDATE_REACTION, update));
                        metricsService.recordReaction(transition.getKind().name().toLowerCase(Locale.ROOT));
                        log.debug("User {} {} on update {}: likes={}, dislikes={}, broadcast to {}",
                            userId, transition, updateId, update.getLikes(), update.getDislikes(), reached);
                        return update;
                    }));
            }));
    }
}
