package com.eainde.analysis.progress;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A single observer's view of one run. Filled by its {@link ProgressBroadcaster}; cancelling it only
 * detaches the observer.
 */
public class ProgressSubscription {

    private final ProgressBroadcaster broadcaster;
    private final BlockingQueue<ProgressEvent> queue;
    private volatile boolean closed;

    ProgressSubscription(ProgressBroadcaster broadcaster, int capacity) {
        this.broadcaster = broadcaster;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    void deliver(ProgressEvent event) {
        if (!queue.offer(event)) {
            throw new IllegalStateException("Subscription queue overflow for run " + broadcaster.runId());
        }
    }

    void close() {
        closed = true;
    }

    /**
     * Next event, waiting up to {@code timeout}. Empty on timeout or once the subscription is drained.
     */
    public Optional<ProgressEvent> next(Duration timeout) throws InterruptedException {
        if (isDrained()) {
            return Optional.empty();
        }
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Collects events until the terminal one arrives or {@code timeout} elapses.
     */
    public List<ProgressEvent> awaitTerminal(Duration timeout) throws InterruptedException {
        List<ProgressEvent> events = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return events;
            }
            ProgressEvent event = queue.poll(remaining, TimeUnit.NANOSECONDS);
            if (event == null) {
                return events;
            }
            events.add(event);
            if (event.terminal()) {
                return events;
            }
        }
    }

    public boolean isDrained() {
        return closed && queue.isEmpty();
    }

    public void cancel() {
        broadcaster.detach(this);
        closed = true;
        queue.clear();
    }
}
