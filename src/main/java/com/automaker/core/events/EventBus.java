package com.automaker.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for auto-mode events.
 * <p>
 * Supports per-project subscriptions and global subscriptions that receive all events.
 * A subscriber that throws is logged and skipped; delivery to the others continues.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-project subscribers keyed by project path. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AutoModeEvent>>> projectSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AutoModeEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AutoModeEvent event) {
        log.debug("Publishing event: {} for project {} feature {}",
                event.type().wireName(), event.projectPath(), event.featureId());

        if (event.projectPath() != null) {
            List<Consumer<AutoModeEvent>> subs = projectSubscribers.get(event.projectPath());
            if (subs != null) {
                for (Consumer<AutoModeEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<AutoModeEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a single project.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String projectPath, Consumer<AutoModeEvent> consumer) {
        projectSubscribers.computeIfAbsent(projectPath, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to project {}", projectPath);
        return () -> {
            CopyOnWriteArrayList<Consumer<AutoModeEvent>> subs = projectSubscribers.get(projectPath);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    projectSubscribers.remove(projectPath, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<AutoModeEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AutoModeEvent> subscriber, AutoModeEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type().wireName(), e.getMessage(), e);
        }
    }
}
