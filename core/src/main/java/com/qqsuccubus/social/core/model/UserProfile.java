package com.qqsuccubus.social.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Public display fields of a user, as sent to clients.
 * <p>
 * Embedded in presence snapshots, enriched direct messages and published updates.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class UserProfile {
    String id;

    String username;

    String profilePicture;

    String avatar;

    @JsonProperty("isVerified")
    boolean verified;

    @JsonProperty("isPremium")
    boolean premium;

    /**
     * Profile carrying only the identifier, used when the store has no record for the user.
     */
    public static UserProfile idOnly(String id) {
        return UserProfile.builder().id(id).build();
    }
}
