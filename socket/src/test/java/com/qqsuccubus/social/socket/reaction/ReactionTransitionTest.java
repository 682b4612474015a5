package com.qqsuccubus.social.socket.reaction;

import com.qqsuccubus.social.core.model.Reaction;
import com.qqsuccubus.social.core.model.ReactionType;
import com.qqsuccubus.social.core.model.UpdatePost;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.qqsuccubus.social.core.model.ReactionType.DISLIKE;
import static com.qqsuccubus.social.core.model.ReactionType.LIKE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ReactionTransitionTest {

    @Test
    void testTableCoversEveryPair() {
        assertEquals(ReactionTransition.ADD_LIKE, ReactionTransition.of(null, LIKE));
        assertEquals(ReactionTransition.ADD_DISLIKE, ReactionTransition.of(null, DISLIKE));
        assertEquals(ReactionTransition.REMOVE_LIKE, ReactionTransition.of(LIKE, LIKE));
        assertEquals(ReactionTransition.REMOVE_DISLIKE, ReactionTransition.of(DISLIKE, DISLIKE));
        assertEquals(ReactionTransition.SWITCH_TO_DISLIKE, ReactionTransition.of(LIKE, DISLIKE));
        assertEquals(ReactionTransition.SWITCH_TO_LIKE, ReactionTransition.of(DISLIKE, LIKE));
    }

    @Test
    void testSwitchKeepsReactionCount() {
        UpdatePost update = updateWith(1, 0, new Reaction("alice", LIKE));

        ReactionTransition.SWITCH_TO_DISLIKE.applyTo(update, "alice");

        assertEquals(0, update.getLikes());
        assertEquals(1, update.getDislikes());
        assertEquals(1, update.getReactions().size());
        assertEquals(DISLIKE, update.getReactions().get(0).getType());
    }

    @Test
    void testRemoveOnlyTouchesOwnReaction() {
        UpdatePost update = updateWith(2, 0, new Reaction("alice", LIKE), new Reaction("bob", LIKE));

        ReactionTransition.REMOVE_LIKE.applyTo(update, "alice");

        assertEquals(1, update.getLikes());
        assertEquals(List.of("bob"), update.getReactions().stream().map(Reaction::getUser).toList());
        assertNull(ReactionTransition.REMOVE_LIKE.getResult());
    }

    @Test
    void testCountsNeverGoNegative() {
        // Stored counts out of step with the reaction list
        UpdatePost update = updateWith(0, 0, new Reaction("alice", ReactionType.LIKE));

        ReactionTransition.SWITCH_TO_DISLIKE.applyTo(update, "alice");

        assertEquals(0, update.getLikes());
        assertEquals(1, update.getDislikes());
    }

    private static UpdatePost updateWith(int likes, int dislikes, Reaction... reactions) {
        return UpdatePost.builder()
            .id("u1")
            .title("t")
            .likes(likes)
            .dislikes(dislikes)
            .reactions(new ArrayList<>(List.of(reactions)))
            .build();
    }
}
