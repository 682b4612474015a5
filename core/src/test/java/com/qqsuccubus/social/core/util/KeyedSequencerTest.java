package com.qqsuccubus.social.core.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KeyedSequencerTest {

    private KeyedSequencer sequencer;

    @BeforeEach
    void setUp() {
        sequencer = new KeyedSequencer();
    }

    @Test
    @DisplayName("Tasks under the same key never overlap and run in subscription order")
    void testSameKeyIsSerialized() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> order = new CopyOnWriteArrayList<>();

        Flux<Integer> tasks = Flux.range(0, 10)
            .flatMap(i -> sequencer.run("update:1", () -> Mono.fromRunnable(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                })
                .then(Mono.delay(Duration.ofMillis(5)))
                .then(Mono.fromCallable(() -> {
                    order.add(i);
                    running.decrementAndGet();
                    return i;
                }))));

        StepVerifier.create(tasks)
            .expectNextCount(10)
            .expectComplete()
            .verify(Duration.ofSeconds(5));

        assertEquals(1, maxRunning.get(), "Only one task per key may run at a time");
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), order);
        assertEquals(0, sequencer.activeKeys());
    }

    @Test
    @DisplayName("Tasks under different keys do not wait for each other")
    void testDifferentKeysRunConcurrently() {
        Sinks.One<String> gate = Sinks.one();

        // The first task can only finish once the second one has run
        Mono<String> first = sequencer.run("update:a", gate::asMono);
        Mono<String> second = sequencer.run("update:b", () -> {
            gate.tryEmitValue("opened");
            return Mono.just("b");
        });

        StepVerifier.create(Flux.merge(first, second).collectList())
            .assertNext(results -> assertEquals(2, results.size()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A failed task releases its key for the next one")
    void testFailureReleasesKey() {
        Mono<String> failing = sequencer.run("k", () -> Mono.error(new IllegalStateException("boom")));
        Mono<String> next = sequencer.run("k", () -> Mono.just("ok"));

        StepVerifier.create(failing).expectError(IllegalStateException.class).verify();
        StepVerifier.create(next).expectNext("ok").verifyComplete();
        assertEquals(0, sequencer.activeKeys());
    }

    @Test
    @DisplayName("The task supplier is not invoked before its turn")
    void testSupplierIsDeferred() {
        Sinks.Empty<Void> hold = Sinks.empty();
        AtomicInteger invoked = new AtomicInteger();

        sequencer.run("k", hold::asMono).subscribe();
        sequencer.run("k", () -> {
            invoked.incrementAndGet();
            return Mono.empty();
        }).subscribe();

        assertEquals(0, invoked.get());
        hold.tryEmitEmpty();
        assertEquals(1, invoked.get());
    }
}
