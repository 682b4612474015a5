package com.qqsuccubus.social.socket.message;

import com.qqsuccubus.social.core.error.DeliveryFailedException;
import com.qqsuccubus.social.core.error.InvalidRequestException;
import com.qqsuccubus.social.core.error.UnauthenticatedException;
import com.qqsuccubus.social.core.model.DirectMessage;
import com.qqsuccubus.social.core.model.UserProfile;
import com.qqsuccubus.social.core.model.UserRecord;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.msg.ServerPayloads.MessageView;
import com.qqsuccubus.social.socket.config.SocketConfig;
import com.qqsuccubus.social.socket.connection.ConnectionRegistry;
import com.qqsuccubus.social.socket.connection.GroupRegistry;
import com.qqsuccubus.social.socket.connection.IConnectionManager;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.store.ISocialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/**
 * Point-to-point messages between users.
 * <p>
 * A message is persisted before anything is delivered. The recipient's connections get
 * {@code newMessage} and the sender's connections get {@code messageSent}, both carrying the
 * message with sender and recipient expanded to profiles. A user's connections are those in the
 * presence registry plus those that joined the user's broadcast group.
 * </p>
 */
public class DirectMessageRelay {
    private static final Logger log = LoggerFactory.getLogger(DirectMessageRelay.class);

    private final ISocialStore store;
    private final ConnectionRegistry registry;
    private final GroupRegistry groups;
    private final IConnectionManager connectionManager;
    private final MetricsService metricsService;
    private final int maxLength;

    public DirectMessageRelay(
        ISocialStore store,
        ConnectionRegistry registry,
        GroupRegistry groups,
        IConnectionManager connectionManager,
        MetricsService metricsService,
        SocketConfig config
    ) {
        this.store = store;
        this.registry = registry;
        this.groups = groups;
        this.connectionManager = connectionManager;
        this.metricsService = metricsService;
        this.maxLength = config.getMessageMaxLength();
    }

    /**
     * Persists and delivers one message.
     *
     * @param senderId    identity of the sending connection, null if it never logged in
     * @param recipientId target user
     * @param text        message body
     * @return the delivered message
     */
    public Mono<MessageView> send(@Nullable String senderId, @Nullable String recipientId, @Nullable String text) {
        if (senderId == null) {
            return Mono.error(new UnauthenticatedException());
        }
        if (recipientId == null || recipientId.isBlank()) {
            return Mono.error(new InvalidRequestException("recipientId is required"));
        }
        if (text == null || text.isBlank()) {
            return Mono.error(new InvalidRequestException("Message text is required"));
        }
        if (text.length() > maxLength) {
            return Mono.error(new InvalidRequestException("Message exceeds " + maxLength + " characters"));
        }

        return store.createMessage(senderId, recipientId, text)
            .flatMap(message -> enrich(message)
                .onErrorMap(err -> new DeliveryFailedException("Failed to deliver message", err)))
            .doOnNext(this::fanOut)
            .doOnError(err -> metricsService.recordMessageFailed());
    }

    /**
     * Connections that should receive events addressed to {@code userId}.
     */
    public Set<String> connectionsOf(String userId) {
        Set<String> targets = new HashSet<>(registry.connectionsOf(userId));
        targets.addAll(groups.members(userId));
        return targets;
    }

    private Mono<MessageView> enrich(DirectMessage message) {
        return Mono.zip(profileOf(message.getSender()), profileOf(message.getRecipient()))
            .map(profiles -> MessageView.of(message, profiles.getT1(), profiles.getT2()));
    }

    private Mono<UserProfile> profileOf(String userId) {
        return store.findUserById(userId)
            .map(UserRecord::toProfile)
            .defaultIfEmpty(UserProfile.idOnly(userId));
    }

    private void fanOut(MessageView view) {
        String recipientId = view.getRecipient().getId();
        String senderId = view.getSender().getId();

        int toRecipient = connectionManager.sendToAll(connectionsOf(recipientId), EventFrame.of(Events.NEW_MESSAGE, view));
        int toSender = connectionManager.sendToAll(connectionsOf(senderId), EventFrame.of(Events.MESSAGE_SENT, view));

        metricsService.recordMessageDelivered();
        log.debug("Message {} from {} to {} delivered to {} recipient and {} sender connections",
            view.getId(), senderId, recipientId, toRecipient, toSender);
    }
}
