package com.qqsuccubus.social.socket.reaction;

import com.qqsuccubus.social.core.model.Reaction;
import com.qqsuccubus.social.core.model.ReactionType;
import com.qqsuccubus.social.core.model.UpdatePost;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.qqsuccubus.social.core.model.ReactionType.DISLIKE;
import static com.qqsuccubus.social.core.model.ReactionType.LIKE;

/**
 * Reaction toggle table. One row per (current reaction, requested reaction) pair; a null
 * current or result means the user has no reaction.
 */
public enum ReactionTransition {
    ADD_LIKE(null, LIKE, LIKE, 1, 0, Kind.ADDED),
    ADD_DISLIKE(null, DISLIKE, DISLIKE, 0, 1, Kind.ADDED),
    REMOVE_LIKE(LIKE, LIKE, null, -1, 0, Kind.REMOVED),
    REMOVE_DISLIKE(DISLIKE, DISLIKE, null, 0, -1, Kind.REMOVED),
    SWITCH_TO_DISLIKE(LIKE, DISLIKE, DISLIKE, -1, 1, Kind.SWITCHED),
    SWITCH_TO_LIKE(DISLIKE, LIKE, LIKE, 1, -1, Kind.SWITCHED);

    public enum Kind {
        ADDED, REMOVED, SWITCHED
    }

    @Nullable
    private final ReactionType current;
    private final ReactionType requested;
    @Nullable
    private final ReactionType result;
    private final int likesDelta;
    private final int dislikesDelta;
    private final Kind kind;

    ReactionTransition(@Nullable ReactionType current, ReactionType requested, @Nullable ReactionType result,
                       int likesDelta, int dislikesDelta, Kind kind) {
        this.current = current;
        this.requested = requested;
        this.result = result;
        this.likesDelta = likesDelta;
        this.dislikesDelta = dislikesDelta;
        this.kind = kind;
    }

    public static ReactionTransition of(@Nullable ReactionType current, ReactionType requested) {
        for (ReactionTransition row : values()) {
            if (row.current == current && row.requested == requested) {
                return row;
            }
        }
        throw new IllegalArgumentException("No transition from " + current + " on " + requested);
    }

    /**
     * Applies this row to {@code update} for {@code userId}. Counts never drop below zero.
     */
    public void applyTo(UpdatePost update, String userId) {
        List<Reaction> reactions = update.getReactions() == null
            ? new ArrayList<>()
            : new ArrayList<>(update.getReactions());

        switch (kind) {
            case ADDED -> reactions.add(new Reaction(userId, result));
            case REMOVED -> reactions.removeIf(reaction -> userId.equals(reaction.getUser()));
            case SWITCHED -> reactions.stream()
                .filter(reaction -> userId.equals(reaction.getUser()))
                .forEach(reaction -> reaction.setType(result));
        }

        update.setReactions(reactions);
        update.setLikes(Math.max(0, update.getLikes() + likesDelta));
        update.setDislikes(Math.max(0, update.getDislikes() + dislikesDelta));
    }

    @Nullable
    public ReactionType getResult() {
        return result;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLikesDelta() {
        return likesDelta;
    }

    public int getDislikesDelta() {
        return dislikesDelta;
    }
}
