package com.qqsuccubus.social.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared post that users react to.
 * <p>
 * {@code likes} and {@code dislikes} are a cached projection of {@code reactions}: they must
 * always equal the number of reactions of each type. Only the reaction aggregator mutates them.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class UpdatePost {
    String id;

    String title;

    String description;

    /**
     * User id of the author.
     */
    String organizer;

    int likes;

    int dislikes;

    @Builder.Default
    List<Reaction> reactions = new ArrayList<>();

    Instant createdAt;

    /**
     * Linear scan for the reaction left by {@code userId}.
     */
    public Optional<Reaction> findReaction(String userId) {
        if (reactions == null) {
            return Optional.empty();
        }
        return reactions.stream()
            .filter(reaction -> userId.equals(reaction.getUser()))
            .findFirst();
    }

    public long countOf(ReactionType type) {
        return reactions == null ? 0 : reactions.stream().filter(r -> r.getType() == type).count();
    }
}
