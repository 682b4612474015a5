package com.qqsuccubus.social.core.msg;

import com.qqsuccubus.social.core.model.DirectMessage;
import com.qqsuccubus.social.core.model.Reaction;
import com.qqsuccubus.social.core.model.UpdatePost;
import com.qqsuccubus.social.core.model.UserProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Server-to-client payloads that differ from the persisted records.
 */
public final class ServerPayloads {
    private ServerPayloads() {
    }

    /**
     * A direct message with sender and recipient expanded to their profiles.
     * Sent as {@code newMessage} to the recipient and {@code messageSent} to the sender.
     */
    @Value
    @Builder
    public static class MessageView {
        String id;
        UserProfile sender;
        UserProfile recipient;
        String text;
        Instant createdAt;

        public static MessageView of(DirectMessage message, UserProfile sender, UserProfile recipient) {
            return MessageView.builder()
                .id(message.getId())
                .sender(sender)
                .recipient(recipient)
                .text(message.getText())
                .createdAt(message.getCreatedAt())
                .build();
        }
    }

    /**
     * A freshly created update with its organizer expanded. Sent as {@code newUpdate}.
     */
    @Value
    @Builder
    public static class PublishedUpdate {
        String id;
        String title;
        String description;
        UserProfile organizer;
        int likes;
        int dislikes;
        List<Reaction> reactions;
        Instant createdAt;

        public static PublishedUpdate of(UpdatePost update, UserProfile organizer) {
            return PublishedUpdate.builder()
                .id(update.getId())
                .title(update.getTitle())
                .description(update.getDescription())
                .organizer(organizer)
                .likes(update.getLikes())
                .dislikes(update.getDislikes())
                .reactions(List.copyOf(update.getReactions()))
                .createdAt(update.getCreatedAt())
                .build();
        }
    }

    /**
     * Payload of {@code messageError} and {@code updateError}.
     */
    public record ErrorPayload(String message) {
    }
}
