package com.eainde.analysis.progress;

import com.eainde.analysis.state.LedgerSnapshot;
import com.eainde.analysis.state.RunStatus;
import com.eainde.analysis.state.StageName;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered fan-out of one run's events.
 * <p>
 * Every subscriber first receives the history, then live events, then the close. History and live delivery
 * happen under the same lock, so no subscriber sees a gap or a duplicate. A run emits at most one event per
 * stage plus one terminal event, which bounds each subscriber's queue.
 */
@Log4j2
public class ProgressBroadcaster {

    static final int CAPACITY = StageName.total() + 1;

    private final String runId;
    private final List<ProgressEvent> history = new ArrayList<>();
    private final List<ProgressSubscription> subscribers = new ArrayList<>();
    private boolean closed;

    public ProgressBroadcaster(String runId) {
        this.runId = runId;
    }

    /**
     * A closed broadcaster holding the full event history of a finished ledger.
     */
    public static ProgressBroadcaster replayOf(LedgerSnapshot snapshot) {
        ProgressBroadcaster broadcaster = new ProgressBroadcaster(snapshot.runId());
        snapshot.stages().forEach(result -> broadcaster.publish(ProgressEvent.stage(result)));
        if (snapshot.status() == RunStatus.COMPLETE) {
            broadcaster.close(ProgressEvent.completed(snapshot.finalReport(), snapshot.completedAt()));
        } else {
            StageName failedAt = snapshot.lastResult().map(r -> r.stage()).orElse(null);
            broadcaster.close(ProgressEvent.failed(failedAt, snapshot.error().orElse(null), snapshot.completedAt()));
        }
        return broadcaster;
    }

    public String runId() {
        return runId;
    }

    public synchronized ProgressSubscription subscribe() {
        ProgressSubscription subscription = new ProgressSubscription(this, CAPACITY);
        history.forEach(subscription::deliver);
        if (closed) {
            subscription.close();
        } else {
            subscribers.add(subscription);
        }
        return subscription;
    }

    public synchronized void publish(ProgressEvent event) {
        if (closed) {
            throw new IllegalStateException("Progress of run " + runId + " is already closed");
        }
        if (event.terminal()) {
            throw new IllegalArgumentException("Terminal events close the broadcaster, use close()");
        }
        append(event);
    }

    /**
     * Publishes the terminal event and closes every subscription. Returns {@code false} if already closed.
     */
    public synchronized boolean close(ProgressEvent terminal) {
        if (closed) {
            log.warn("Progress of run {} closed twice, ignoring {}", runId, terminal.type());
            return false;
        }
        if (!terminal.terminal()) {
            throw new IllegalArgumentException("Not a terminal event: " + terminal.type());
        }
        append(terminal);
        closed = true;
        subscribers.forEach(ProgressSubscription::close);
        subscribers.clear();
        return true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized List<ProgressEvent> history() {
        return List.copyOf(history);
    }

    synchronized void detach(ProgressSubscription subscription) {
        subscribers.remove(subscription);
    }

    private void append(ProgressEvent event) {
        history.add(event);
        subscribers.forEach(subscriber -> subscriber.deliver(event));
    }
}
