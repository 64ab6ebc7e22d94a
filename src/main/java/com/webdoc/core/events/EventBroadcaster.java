package com.webdoc.core.events;

import com.webdoc.config.WebDocProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory fan-out from the orchestration core to connected observers.
 * <p>
 * Each observer owns a bounded queue that it drains at its own pace, so publishing never
 * blocks on a slow or dead client and never throws. An observer whose queue overflows is
 * treated as disconnected and pruned. Thread-safe for concurrent publish, subscribe and
 * unsubscribe.
 * <p>
 * Callers are responsible for publishing one session's events from a single ordering point;
 * per-observer delivery order then matches publication order.
 */
@Service
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final CopyOnWriteArrayList<Observer> observers = new CopyOnWriteArrayList<>();
    private final AtomicLong observerIds = new AtomicLong();
    private final int queueCapacity;

    @Autowired
    public EventBroadcaster(WebDocProperties properties) {
        this(properties.getEvents().getObserverQueueCapacity());
    }

    public EventBroadcaster(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    /**
     * Delivers an event to every registered observer.
     *
     * @param event the event to publish
     */
    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for session {} to {} observers",
                event.eventType(), event.sessionId(), observers.size());
        for (Observer observer : observers) {
            if (!observer.offer(event)) {
                log.debug("Observer {} queue full or closed, pruning", observer.id());
                unsubscribe(observer);
            }
        }
    }

    /**
     * Registers a new observer whose first queued event is {@code snapshot}.
     * <p>
     * The caller must hold whatever lock orders its publications so that no event is
     * published between building the snapshot and registering the observer.
     *
     * @param snapshot synthesized current-state event delivered before anything else
     * @return handle used to drain events and to unsubscribe
     */
    public Observer subscribe(PipelineEvent snapshot) {
        Observer observer = new Observer(observerIds.incrementAndGet(), queueCapacity);
        observer.offer(snapshot);
        observers.add(observer);
        log.debug("Observer {} subscribed ({} active)", observer.id(), observers.size());
        return observer;
    }

    /**
     * Removes an observer. Idempotent.
     */
    public void unsubscribe(Observer observer) {
        observer.close();
        if (observers.remove(observer)) {
            log.debug("Observer {} unsubscribed ({} active)", observer.id(), observers.size());
        }
    }

    public int observerCount() {
        return observers.size();
    }

    /**
     * Pull-side handle for one connected observer.
     */
    public static final class Observer {

        private final long id;
        private final BlockingQueue<PipelineEvent> queue;
        private volatile boolean closed;

        Observer(long id, int capacity) {
            this.id = id;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }

        public long id() {
            return id;
        }

        boolean offer(PipelineEvent event) {
            return !closed && queue.offer(event);
        }

        /**
         * Waits up to {@code timeout} for the next event.
         *
         * @return the next event, or null if none arrived in time
         * @throws InterruptedException if interrupted while waiting
         */
        public PipelineEvent poll(Duration timeout) throws InterruptedException {
            return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        /** Number of events queued but not yet drained. */
        public int pending() {
            return queue.size();
        }

        public boolean isClosed() {
            return closed;
        }

        void close() {
            closed = true;
        }
    }
}
