package com.qqsuccubus.social.socket.store;

import com.qqsuccubus.social.core.error.PersistenceException;
import com.qqsuccubus.social.core.model.DirectMessage;
import com.qqsuccubus.social.core.model.UpdatePost;
import com.qqsuccubus.social.core.model.UserRecord;
import com.qqsuccubus.social.core.redis.Keys;
import com.qqsuccubus.social.core.util.JsonUtils;
import com.qqsuccubus.social.socket.config.SocketConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reactive Redis implementation of the social store.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. Key layout is defined in
 * {@link Keys}. Driver errors surface as {@link PersistenceException}.
 * </p>
 */
public class RedisSocialStore implements ISocialStore {
    private static final Logger log = LoggerFactory.getLogger(RedisSocialStore.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisSocialStore(SocketConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<List<UserRecord>> findUsersByIdIn(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Mono.just(List.of());
        }
        return guard(
            Flux.fromIterable(ids)
                .flatMapSequential(id -> readUser(id))
                .collectList(),
            "find users " + ids.size()
        );
    }

    @Override
    public Mono<UserRecord> findUserById(String userId) {
        return guard(readUser(userId), "find user " + userId);
    }

    @Override
    public Mono<Void> setUserOnlineStatus(String userId, boolean online, Instant lastSeen) {
        String key = Keys.user(userId);
        Map<String, String> fields = Map.of(
            UserRecord.F_ONLINE, String.valueOf(online),
            UserRecord.F_LAST_SEEN, String.valueOf(lastSeen.toEpochMilli())
        );

        // Only touch existing users, otherwise a stray id would create a half-empty document
        return guard(
            commands.exists(key)
                .filter(count -> count > 0)
                .flatMap(count -> commands.hset(key, fields))
                .then(),
            "set online status of " + userId
        ).doOnSuccess(v -> log.debug("User {} marked {} in store", userId, online ? "online" : "offline"));
    }

    /**
     * Merges settings field by field. A boolean {@code showOnlineStatus} is mirrored onto the
     * user document, which is where presence visibility is read from.
     */
    @Override
    public Mono<Map<String, Object>> upsertUserSettings(String userId, Map<String, Object> partialSettings) {
        String key = Keys.settings(userId);

        Map<String, String> encoded = new HashMap<>();
        partialSettings.forEach((field, value) -> encoded.put(field, JsonUtils.writeValueAsString(value)));

        Mono<Long> write = encoded.isEmpty() ? Mono.just(0L) : commands.hset(key, encoded);

        Mono<Long> mirror = Mono.empty();
        if (partialSettings.get(UserRecord.F_SHOW_ONLINE_STATUS) instanceof Boolean visible) {
            String userKey = Keys.user(userId);
            mirror = commands.exists(userKey)
                .filter(count -> count > 0)
                .flatMap(count -> commands.hset(userKey, UserRecord.F_SHOW_ONLINE_STATUS, String.valueOf(visible))
                    .map(created -> created ? 1L : 0L));
        }

        Mono<Map<String, Object>> reload = commands.hgetall(key)
            .collectMap(KeyValue::getKey, kv -> JsonUtils.readValue(kv.getValue(), Object.class),
                LinkedHashMap::new);

        return guard(write.then(mirror).then(reload), "upsert settings of " + userId);
    }

    @Override
    public Mono<DirectMessage> createMessage(String sender, String recipient, String text) {
        DirectMessage message = DirectMessage.builder()
            .id(UUID.randomUUID().toString())
            .sender(sender)
            .recipient(recipient)
            .text(text)
            .createdAt(Instant.now())
            .build();

        return guard(
            commands.set(Keys.message(message.getId()), JsonUtils.writeValueAsString(message))
                .then(commands.rpush(Keys.conversation(sender, recipient), message.getId()))
                .thenReturn(message),
            "create message from " + sender + " to " + recipient
        );
    }

    @Override
    public Mono<UpdatePost> loadUpdateById(String updateId) {
        return guard(
            commands.get(Keys.update(updateId))
                .map(json -> JsonUtils.readValue(json, UpdatePost.class)),
            "load update " + updateId
        );
    }

    @Override
    public Mono<Void> saveUpdate(UpdatePost update) {
        return guard(
            commands.set(Keys.update(update.getId()), JsonUtils.writeValueAsString(update)).then(),
            "save update " + update.getId()
        );
    }

    @Override
    public Mono<UpdatePost> createUpdate(String organizer, String title, String description) {
        UpdatePost update = UpdatePost.builder()
            .id(UUID.randomUUID().toString())
            .title(title)
            .description(description)
            .organizer(organizer)
            .createdAt(Instant.now())
            .build();

        return guard(
            commands.set(Keys.update(update.getId()), JsonUtils.writeValueAsString(update))
                .then(commands.lpush(Keys.updatesFeed(), update.getId()))
                .thenReturn(update),
            "create update by " + organizer
        );
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }

    private Mono<UserRecord> readUser(String userId) {
        return commands.hgetall(Keys.user(userId))
            .collectMap(KeyValue::getKey, KeyValue::getValue)
            .filter(hash -> !hash.isEmpty())
            .map(hash -> UserRecord.fromHash(hash).withId(userId));
    }

    private <T> Mono<T> guard(Mono<T> operation, String description) {
        return operation
            .doOnError(err -> log.error("Redis operation failed: {}", description, err))
            .onErrorMap(err -> !(err instanceof PersistenceException),
                err -> new PersistenceException("Failed to " + description, err));
    }
}
