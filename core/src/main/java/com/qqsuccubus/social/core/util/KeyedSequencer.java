package com.qqsuccubus.social.core.util;

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks one at a time per key.
 * <p>
 * Tasks submitted under the same key execute in subscription order, each starting only after the
 * previous one has terminated (completed, failed or been cancelled). Tasks under different keys
 * never wait for each other. Nothing blocks a thread: a waiting task is resumed on the thread that
 * finished its predecessor.
 * </p>
 * <p>
 * Usage: {@code sequencer.run("update:" + id, () -> loadModifySave(id))}. The task supplier is only
 * invoked once the task's turn has come.
 * </p>
 */
public final class KeyedSequencer {

    // key -> completion of the most recently queued task for that key
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> run(String key, Supplier<? extends Mono<T>> task) {
        return Mono.defer(() -> {
            CompletableFuture<Void> done = new CompletableFuture<>();
            CompletableFuture<Void> previous = tails.put(key, done);

            Mono<Void> turn = previous == null ? Mono.empty() : Mono.fromFuture(previous, true);

            return turn.then(Mono.defer(task))
                .doFinally(signal -> release(key, previous, done));
        });
    }

    /**
     * Number of keys that currently have a running or queued task.
     */
    public int activeKeys() {
        return tails.size();
    }

    private void release(String key, CompletableFuture<Void> previous, CompletableFuture<Void> done) {
        // A task cancelled while still queued must not let its successor overtake the predecessor.
        if (previous == null || previous.isDone()) {
            complete(key, done);
        } else {
            previous.whenComplete((v, e) -> complete(key, done));
        }
    }

    private void complete(String key, CompletableFuture<Void> done) {
        tails.remove(key, done);
        done.complete(null);
    }
}
