package com.qqsuccubus.social.socket.ws;

import com.qqsuccubus.social.core.metrics.MetricsNames;
import com.qqsuccubus.social.core.metrics.MetricsTags;
import com.qqsuccubus.social.core.model.UpdatePost;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.msg.ServerPayloads.ErrorPayload;
import com.qqsuccubus.social.core.util.JsonUtils;
import com.qqsuccubus.social.core.util.KeyedSequencer;
import com.qqsuccubus.social.socket.TestFixtures;
import com.qqsuccubus.social.socket.TestSocialStore;
import com.qqsuccubus.social.socket.config.SocketConfig;
import com.qqsuccubus.social.socket.connection.Connection;
import com.qqsuccubus.social.socket.connection.ConnectionFactory;
import com.qqsuccubus.social.socket.connection.ConnectionManager;
import com.qqsuccubus.social.socket.connection.ConnectionRegistry;
import com.qqsuccubus.social.socket.connection.GroupRegistry;
import com.qqsuccubus.social.socket.message.DirectMessageRelay;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import com.qqsuccubus.social.socket.presence.PresenceBroadcaster;
import com.qqsuccubus.social.socket.presence.PresenceService;
import com.qqsuccubus.social.socket.reaction.ReactionAggregator;
import com.qqsuccubus.social.socket.update.UpdatePublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives the dispatcher with decoded client frames, the way the WebSocket handler does.
 */
class EventDispatcherTest {

    private TestSocialStore store;
    private SimpleMeterRegistry meterRegistry;
    private ConnectionRegistry registry;
    private GroupRegistry groups;
    private ConnectionManager connectionManager;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SocketConfig config = TestFixtures.config();
        store = new TestSocialStore()
            .withUser("alice", "Alice", true)
            .withUser("bob", "Bob", true);
        meterRegistry = new SimpleMeterRegistry();
        MetricsService metricsService = new MetricsService(meterRegistry, config);
        registry = new ConnectionRegistry();
        groups = new GroupRegistry();
        connectionManager = new ConnectionManager(new ConnectionFactory(config), metricsService);
        KeyedSequencer sequencer = new KeyedSequencer();

        PresenceBroadcaster broadcaster = new PresenceBroadcaster(
            registry, store, connectionManager, sequencer, metricsService
        );
        dispatcher = new EventDispatcher(
            new PresenceService(registry, groups, store, broadcaster, sequencer, Clock.systemUTC()),
            new DirectMessageRelay(store, registry, groups, connectionManager, metricsService, config),
            new ReactionAggregator(store, connectionManager, sequencer, metricsService),
            new UpdatePublisher(store, connectionManager, metricsService),
            groups,
            connectionManager,
            metricsService
        );
    }

    @Test
    void testLoginThenMessage() {
        Connection alice = connectionManager.open();
        Connection bob = connectionManager.open();
        List<EventFrame> aliceFrames = TestFixtures.capture(alice);
        List<EventFrame> bobFrames = TestFixtures.capture(bob);

        dispatch(alice, frame("{\"event\":\"userLogin\",\"data\":\"alice\"}"));
        dispatch(bob, frame("{\"event\":\"userLogin\",\"data\":\"bob\"}"));
        dispatch(alice, frame("{\"event\":\"sendMessage\",\"data\":{\"recipientId\":\"bob\",\"text\":\"hey\"}}"));

        assertEquals(1, TestFixtures.framesNamed(bobFrames, Events.NEW_MESSAGE).size());
        assertEquals(1, TestFixtures.framesNamed(aliceFrames, Events.MESSAGE_SENT).size());
        assertEquals(2, TestFixtures.framesNamed(aliceFrames, Events.ONLINE_USERS).size());
        assertTrue(TestFixtures.framesNamed(aliceFrames, Events.MESSAGE_ERROR).isEmpty());
    }

    @Test
    void testUnauthenticatedSendGetsMessageError() {
        Connection anonymous = connectionManager.open();
        List<EventFrame> frames = TestFixtures.capture(anonymous);

        dispatch(anonymous, frame("{\"event\":\"sendMessage\",\"data\":{\"recipientId\":\"bob\",\"text\":\"hey\"}}"));

        assertEquals(List.of("User not authenticated"), errorMessages(frames, Events.MESSAGE_ERROR));
        assertTrue(store.messages.isEmpty());
    }

    @Test
    void testPersistenceFailureIsReportedGenerically() {
        store.failCreateMessage = true;
        Connection alice = loggedIn("alice");
        List<EventFrame> frames = TestFixtures.capture(alice);

        dispatch(alice, frame("{\"event\":\"sendMessage\",\"data\":{\"recipientId\":\"bob\",\"text\":\"hey\"}}"));

        assertEquals(List.of(EventDispatcher.SEND_FAILED), errorMessages(frames, Events.MESSAGE_ERROR));
    }

    @Test
    void testMalformedPayloadIsReported() {
        Connection alice = loggedIn("alice");
        List<EventFrame> frames = TestFixtures.capture(alice);

        dispatch(alice, frame("{\"event\":\"sendMessage\",\"data\":\"not an object\"}"));
        dispatch(alice, frame("{\"event\":\"createUpdate\"}"));

        assertEquals(List.of("Malformed payload"), errorMessages(frames, Events.MESSAGE_ERROR));
        assertEquals(List.of("Payload is required"), errorMessages(frames, Events.UPDATE_ERROR));
    }

    @Test
    void testReactionOnMissingUpdate() {
        Connection alice = loggedIn("alice");
        List<EventFrame> frames = TestFixtures.capture(alice);

        dispatch(alice, frame("{\"event\":\"updateReaction\",\"data\":{\"updateId\":\"nope\",\"reactionType\":\"like\"}}"));

        assertEquals(List.of("Update not found"), errorMessages(frames, Events.UPDATE_ERROR));
    }

    @Test
    void testCreateUpdateAndReact() {
        Connection alice = loggedIn("alice");
        List<EventFrame> frames = TestFixtures.capture(alice);

        dispatch(alice, frame("{\"event\":\"createUpdate\",\"data\":{\"title\":\"Launch\",\"description\":\"v1\"}}"));
        String updateId = store.updates.keySet().iterator().next();
        dispatch(alice, frame("{\"event\":\"updateReaction\",\"data\":{\"updateId\":\"" + updateId
            + "\",\"reactionType\":\"like\"}}"));

        assertEquals(1, TestFixtures.framesNamed(frames, Events.NEW_UPDATE).size());
        List<EventFrame> reactions = TestFixtures.framesNamed(frames, Events.UPDATE_REACTION);
        assertEquals(1, reactions.size());
        assertEquals(1, ((UpdatePost) reactions.get(0).getData()).getLikes());
    }

    @Test
    void testJoinUserRoomAddsToGroup() {
        Connection device = connectionManager.open();

        dispatch(device, frame("{\"event\":\"joinUserRoom\",\"data\":\"bob\"}"));

        assertTrue(groups.members("bob").contains(device.getConnectionId()));
    }

    @Test
    void testSettingsFailuresAreNotSentToClient() {
        Connection anonymous = connectionManager.open();
        List<EventFrame> frames = TestFixtures.capture(anonymous);

        dispatch(anonymous, frame("{\"event\":\"updateSettings\",\"data\":{\"showOnlineStatus\":false}}"));

        assertTrue(frames.isEmpty());
        assertTrue(store.settings.isEmpty());
    }

    @Test
    void testSettingsFromFrame() {
        Connection alice = loggedIn("alice");

        dispatch(alice, frame("{\"event\":\"updateSettings\",\"data\":{\"showOnlineStatus\":false,\"theme\":\"dark\"}}"));

        assertEquals(Map.of("showOnlineStatus", false, "theme", "dark"), store.settings.get("alice"));
        assertFalse(store.users.get("alice").isShowOnlineStatus());
    }

    @Test
    void testUnknownAndReservedEventsAreIgnored() {
        Connection alice = loggedIn("alice");
        List<EventFrame> frames = TestFixtures.capture(alice);

        dispatch(alice, frame("{\"event\":\"dance\",\"data\":1}"));
        dispatch(alice, frame("{\"event\":\"disconnect\"}"));
        dispatch(alice, frame("{\"data\":1}"));

        assertTrue(frames.isEmpty());
        assertTrue(registry.isOnline("alice"));
    }

    @Test
    void testTransportCloseTakesUserOffline() {
        Connection alice = loggedIn("alice");
        Connection observer = connectionManager.open();
        List<EventFrame> frames = TestFixtures.capture(observer);

        StepVerifier.create(dispatcher.disconnected(alice))
            .expectComplete()
            .verify(Duration.ofSeconds(1));

        assertFalse(registry.isOnline("alice"));
        assertEquals(1, TestFixtures.framesNamed(frames, Events.ONLINE_USERS).size());
        assertEquals(Optional.of("alice"), alice.getUserId(), "Identity outlives the transport");
    }

    @Test
    @DisplayName("A login still queued when the transport closes leaves no ghost presence")
    void testLoginAfterTransportCloseIsDropped() {
        Connection device = connectionManager.open();
        connectionManager.close(device.getConnectionId());
        StepVerifier.create(dispatcher.disconnected(device))
            .expectComplete()
            .verify(Duration.ofSeconds(1));

        dispatch(device, frame("{\"event\":\"userLogin\",\"data\":\"alice\"}"));
        dispatch(device, frame("{\"event\":\"joinUserRoom\",\"data\":\"alice\"}"));

        assertFalse(registry.isOnline("alice"));
        assertTrue(registry.connectionsOf("alice").isEmpty());
        assertTrue(groups.members("alice").isEmpty());
        assertTrue(store.statusWrites.isEmpty());
        assertFalse(store.users.get("alice").isOnline());
    }

    @Test
    void testUnknownEventNamesShareOneTimer() {
        Connection device = connectionManager.open();

        for (int i = 0; i < 100; i++) {
            dispatch(device, EventFrame.of("junk-" + i, null));
        }

        assertEquals(1, meterRegistry.find(MetricsNames.EVENT_LATENCY).timers().size());
        assertEquals(100, meterRegistry.get(MetricsNames.EVENT_LATENCY)
            .tag(MetricsTags.EVENT, EventDispatcher.UNKNOWN_EVENT).timer().count());
    }

    @Test
    void testEventLatencyIsRecorded() {
        Connection device = connectionManager.open();

        dispatch(device, frame("{\"event\":\"joinUserRoom\",\"data\":\"bob\"}"));

        assertEquals(1, meterRegistry.get(MetricsNames.EVENT_LATENCY).tag(MetricsTags.EVENT, Events.JOIN_USER_ROOM).timer().count());
    }

    private Connection loggedIn(String userId) {
        Connection connection = connectionManager.open();
        dispatch(connection, EventFrame.of(Events.USER_LOGIN, userId));
        return connection;
    }

    private void dispatch(Connection connection, EventFrame frame) {
        StepVerifier.create(dispatcher.dispatch(connection, frame))
            .expectComplete()
            .verify(Duration.ofSeconds(1));
    }

    private static EventFrame frame(String json) {
        return JsonUtils.readValue(json, EventFrame.class);
    }

    private static List<String> errorMessages(List<EventFrame> frames, String event) {
        return TestFixtures.framesNamed(frames, event).stream()
            .map(frame -> ((ErrorPayload) frame.getData()).message())
            .toList();
    }
}
