package com.qqsuccubus.social.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Typed payloads of the client-to-server events that carry an object.
 */
public final class ClientRequests {
    private ClientRequests() {
    }

    /**
     * Payload of {@code sendMessage}.
     */
    @Value
    @Builder(toBuilder = true)
    public static class SendMessage {
        @JsonProperty("recipientId")
        String recipientId;

        @JsonProperty("text")
        String text;

        @JsonCreator
        public SendMessage(
            @JsonProperty("recipientId") String recipientId,
            @JsonProperty("text") String text
        ) {
            this.recipientId = recipientId;
            this.text = text;
        }
    }

    /**
     * Payload of {@code createUpdate}.
     */
    @Value
    @Builder(toBuilder = true)
    public static class CreateUpdate {
        @JsonProperty("title")
        String title;

        @JsonProperty("description")
        String description;

        @JsonCreator
        public CreateUpdate(
            @JsonProperty("title") String title,
            @JsonProperty("description") String description
        ) {
            this.title = title;
            this.description = description;
        }
    }

    /**
     * Payload of inbound {@code updateReaction}. The reaction type stays a raw string so an
     * unknown value can be reported to the client instead of failing decoding.
     */
    @Value
    @Builder(toBuilder = true)
    public static class UpdateReaction {
        @JsonProperty("updateId")
        String updateId;

        @JsonProperty("reactionType")
        String reactionType;

        @JsonCreator
        public UpdateReaction(
            @JsonProperty("updateId") String updateId,
            @JsonProperty("reactionType") String reactionType
        ) {
            this.updateId = updateId;
            this.reactionType = reactionType;
        }
    }
}
