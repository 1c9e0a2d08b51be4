package com.automaker.dispatch.api;

import com.automaker.core.events.AutoModeEvent;
import com.automaker.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * One emitter per client, subscribed to a single project's events, or to all projects when
 * no project is given. A heartbeat comment goes to every open emitter every 30 seconds so
 * idle connections survive proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Emitters live as long as a plan approval can wait. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for {}: {}", registration.scope(), e.getMessage());
            }
        }
    }

    /**
     * @param projectPath project to stream, or null for every project
     */
    public SseEmitter createEmitter(String projectPath) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = projectPath != null
                ? eventBus.subscribe(projectPath, event -> sendEvent(emitter, event))
                : eventBus.subscribeAll(event -> sendEvent(emitter, event));

        var registration = new EmitterRegistration(projectPath, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", registration.scope(), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for {}: {}", registration.scope(), e.getMessage());
        }

        log.info("SSE emitter created for {} (timeout={}ms)", registration.scope(), timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, AutoModeEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.type().wireName())
                    .data(event.toWireMap()));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for {}: {}",
                    event.type().wireName(), event.projectPath(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for {}", registration.scope());
    }

    private record EmitterRegistration(String projectPath, SseEmitter emitter, EventBus.Subscription subscription) {
        String scope() {
            return projectPath != null ? "project " + projectPath : "all projects";
        }
    }
}
