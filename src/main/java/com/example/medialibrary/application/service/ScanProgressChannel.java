package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.model.ScanProgressEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded single-producer, single-consumer stream of scan progress events. Publishing never blocks.
 * After {@link ScanProgressEvent.Complete} has been published the channel refuses further events, and once
 * the consumer has taken it the channel reports itself as finished.
 */
public class ScanProgressChannel {

    private final LinkedBlockingQueue<ScanProgressEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean terminalPublished = new AtomicBoolean(false);
    private volatile boolean terminalConsumed;

    public void publish(ScanProgressEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (terminalPublished.get()) {
            throw new IllegalStateException("scan progress channel already completed");
        }
        if (event.isTerminal() && !terminalPublished.compareAndSet(false, true)) {
            throw new IllegalStateException("scan progress channel already completed");
        }
        events.offer(event);
    }

    /**
     * Removes up to {@code maxEvents} buffered events in publish order.
     */
    public List<ScanProgressEvent> drain(int maxEvents) {
        List<ScanProgressEvent> drained = new ArrayList<>();
        if (maxEvents <= 0) {
            return drained;
        }
        events.drainTo(drained, maxEvents);
        for (ScanProgressEvent event : drained) {
            track(event);
        }
        return drained;
    }

    public int backlog() {
        return events.size();
    }

    public boolean isFinished() {
        return terminalConsumed;
    }

    private ScanProgressEvent track(ScanProgressEvent event) {
        if (event != null && event.isTerminal()) {
            terminalConsumed = true;
        }
        return event;
    }
}
