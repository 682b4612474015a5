package com.qqsuccubus.social.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Reaction category on an update. Serialized in lowercase.
 */
public enum ReactionType {
    LIKE("like"),
    DISLIKE("dislike");

    private final String wireName;

    ReactionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<ReactionType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ReactionType type : values()) {
            if (type.wireName.equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ReactionType fromWire(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown reaction type: " + value));
    }
}
