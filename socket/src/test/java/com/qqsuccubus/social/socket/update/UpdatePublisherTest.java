package com.qqsuccubus.social.socket.update;

import com.qqsuccubus.social.core.error.PersistenceException;
import com.qqsuccubus.social.core.error.UnauthenticatedException;
import com.qqsuccubus.social.core.msg.EventFrame;
import com.qqsuccubus.social.core.msg.Events;
import com.qqsuccubus.social.core.msg.ServerPayloads.PublishedUpdate;
import com.qqsuccubus.social.socket.TestFixtures;
import com.qqsuccubus.social.socket.TestSocialStore;
import com.qqsuccubus.social.socket.config.SocketConfig;
import com.qqsuccubus.social.socket.connection.ConnectionFactory;
import com.qqsuccubus.social.socket.connection.ConnectionManager;
import com.qqsuccubus.social.socket.metrics.MetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpdatePublisherTest {

    private TestSocialStore store;
    private ConnectionManager connectionManager;
    private UpdatePublisher publisher;

    @BeforeEach
    void setUp() {
        SocketConfig config = TestFixtures.config();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        store = new TestSocialStore().withUser("alice", "Alice", true);
        connectionManager = new ConnectionManager(new ConnectionFactory(config), metricsService);
        publisher = new UpdatePublisher(store, connectionManager, metricsService);
    }

    @Test
    void testNewUpdateIsAnnouncedWithOrganizerProfile() {
        List<EventFrame> frames = TestFixtures.capture(connectionManager.open());

        StepVerifier.create(publisher.createUpdate("alice", "Launch", "We shipped"))
            .assertNext(update -> {
                assertEquals("Alice", update.getOrganizer().getUsername());
                assertEquals(0, update.getLikes());
                assertTrue(update.getReactions().isEmpty());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(1));

        assertEquals(1, store.updates.size());
        assertEquals(1, frames.size());
        assertEquals(Events.NEW_UPDATE, frames.get(0).getEvent());
        assertEquals("Launch", ((PublishedUpdate) frames.get(0).getData()).getTitle());
    }

    @Test
    void testMissingOrganizerFallsBackToId() {
        StepVerifier.create(publisher.createUpdate("ghost", "Hello", null))
            .assertNext(update -> {
                assertEquals("ghost", update.getOrganizer().getId());
                assertNull(update.getOrganizer().getUsername());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(1));
    }

    @Test
    void testRequiresIdentity() {
        StepVerifier.create(publisher.createUpdate(null, "Launch", "We shipped"))
            .expectError(UnauthenticatedException.class)
            .verify(Duration.ofSeconds(1));

        assertTrue(store.updates.isEmpty());
    }

    @Test
    void testStoreFailureBroadcastsNothing() {
        store.failCreateUpdate = true;
        List<EventFrame> frames = TestFixtures.capture(connectionManager.open());

        StepVerifier.create(publisher.createUpdate("alice", "Launch", "We shipped"))
            .expectError(PersistenceException.class)
            .verify(Duration.ofSeconds(1));

        assertTrue(frames.isEmpty());
    }
}
