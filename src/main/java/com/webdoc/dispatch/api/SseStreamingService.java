package com.webdoc.dispatch.api;

import com.webdoc.config.WebDocProperties;
import com.webdoc.core.engine.SessionController;
import com.webdoc.core.events.EventBroadcaster;
import com.webdoc.core.events.PipelineEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges {@link EventBroadcaster} observers to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each connected client gets its own observer and a pump task that drains the observer's queue
 * into the emitter. The first frame is always the {@code snapshot} event. A failed send ends the
 * pump and unsubscribes the observer; nothing is reported back to the pipeline.
 * <p>
 * Heartbeats are sent as SSE comments (lines starting with ':') which EventSource clients
 * ignore, keeping idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    private final SessionController sessionController;
    private final long timeoutMs;
    private final long heartbeatIntervalMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger pumpCounter = new AtomicInteger();
    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump-" + pumpCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(SessionController sessionController, WebDocProperties properties) {
        this(sessionController, properties.getSse().getTimeout().toMillis(),
                properties.getSse().getHeartbeatInterval().toMillis());
    }

    SseStreamingService(SessionController sessionController, long timeoutMs, long heartbeatIntervalMs) {
        this.sessionController = sessionController;
        this.timeoutMs = timeoutMs;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
        log.info("SSE heartbeat scheduler started (interval={}ms)", heartbeatIntervalMs);
    }

    @PreDestroy
    void shutdown() {
        activeRegistrations.forEach(this::cleanup);
        heartbeatScheduler.shutdownNow();
        pumps.shutdownNow();
        log.info("SSE streaming stopped");
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for observer {}: {}", registration.observer().id(), e.getMessage());
                cleanup(registration);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams the session's events, starting with a snapshot.
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBroadcaster.Observer observer = sessionController.subscribe();
        var registration = new EmitterRegistration(emitter, observer, new AtomicBoolean(true));
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for observer {}", observer.id());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for observer {}: {}", observer.id(), ex.getMessage());
            cleanup(registration);
        });

        pumps.execute(() -> pump(registration));
        log.info("SSE emitter created for observer {} (timeout={}ms)", observer.id(), timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void pump(EmitterRegistration registration) {
        EventBroadcaster.Observer observer = registration.observer();
        try {
            while (registration.active().get() && !observer.isClosed()) {
                PipelineEvent event = observer.poll(POLL_INTERVAL);
                if (event != null) {
                    registration.emitter().send(toFrame(event));
                }
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE send failed for observer {}: {}", observer.id(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            cleanup(registration);
        }
    }

    static SseEmitter.SseEventBuilder toFrame(PipelineEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (event.sessionId() != null) {
            data.put("session_id", event.sessionId());
        }
        if (event.topicId() != null) {
            data.put("topic_id", event.topicId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return SseEmitter.event().name(event.eventType()).data(data);
    }

    private void cleanup(EmitterRegistration registration) {
        if (registration.active().compareAndSet(true, false)) {
            sessionController.unsubscribe(registration.observer());
            activeRegistrations.remove(registration);
            log.debug("Cleaned up SSE registration for observer {}", registration.observer().id());
        }
    }

    private record EmitterRegistration(
            SseEmitter emitter,
            EventBroadcaster.Observer observer,
            AtomicBoolean active
    ) {}
}
