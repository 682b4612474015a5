package com.qqsuccubus.social.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Persisted user document as seen by the realtime core.
 * <p>
 * Stored as a Redis hash; {@link #fromHash(Map)} and {@link #toHash()} define the field layout.
 * A missing {@code showOnlineStatus} field means the user has never hidden their status.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class UserRecord {
    public static final String F_ID = "id";
    public static final String F_USERNAME = "username";
    public static final String F_PROFILE_PICTURE = "profilePicture";
    public static final String F_AVATAR = "avatar";
    public static final String F_VERIFIED = "isVerified";
    public static final String F_PREMIUM = "isPremium";
    public static final String F_SHOW_ONLINE_STATUS = "showOnlineStatus";
    public static final String F_ONLINE = "isOnline";
    public static final String F_LAST_SEEN = "lastSeen";

    String id;
    String username;
    String profilePicture;
    String avatar;
    boolean verified;
    boolean premium;
    @Builder.Default
    boolean showOnlineStatus = true;
    boolean online;
    Instant lastSeen;

    public UserProfile toProfile() {
        return UserProfile.builder()
            .id(id)
            .username(username)
            .profilePicture(profilePicture)
            .avatar(avatar)
            .verified(verified)
            .premium(premium)
            .build();
    }

    public static UserRecord fromHash(Map<String, String> hash) {
        String lastSeen = hash.get(F_LAST_SEEN);
        String showOnline = hash.get(F_SHOW_ONLINE_STATUS);
        return UserRecord.builder()
            .id(hash.get(F_ID))
            .username(hash.get(F_USERNAME))
            .profilePicture(hash.get(F_PROFILE_PICTURE))
            .avatar(hash.get(F_AVATAR))
            .verified(Boolean.parseBoolean(hash.get(F_VERIFIED)))
            .premium(Boolean.parseBoolean(hash.get(F_PREMIUM)))
            .showOnlineStatus(showOnline == null || Boolean.parseBoolean(showOnline))
            .online(Boolean.parseBoolean(hash.get(F_ONLINE)))
            .lastSeen(lastSeen == null ? null : Instant.ofEpochMilli(Long.parseLong(lastSeen)))
            .build();
    }

    public Map<String, String> toHash() {
        Map<String, String> hash = new HashMap<>();
        hash.put(F_ID, id);
        putIfPresent(hash, F_USERNAME, username);
        putIfPresent(hash, F_PROFILE_PICTURE, profilePicture);
        putIfPresent(hash, F_AVATAR, avatar);
        hash.put(F_VERIFIED, String.valueOf(verified));
        hash.put(F_PREMIUM, String.valueOf(premium));
        hash.put(F_SHOW_ONLINE_STATUS, String.valueOf(showOnlineStatus));
        hash.put(F_ONLINE, String.valueOf(online));
        if (lastSeen != null) {
            hash.put(F_LAST_SEEN, String.valueOf(lastSeen.toEpochMilli()));
        }
        return hash;
    }

    private static void putIfPresent(Map<String, String> hash, String field, String value) {
        if (value != null) {
            hash.put(field, value);
        }
    }
}
