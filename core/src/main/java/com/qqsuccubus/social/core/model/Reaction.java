package com.qqsuccubus.social.core.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One user's reaction on an update. At most one exists per user and update.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Reaction {
    String user;
    ReactionType type;
}
