package com.automaker.core.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent user-facing notifications in memory.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    static final int MAX_NOTIFICATIONS = 200;

    private final Deque<Notification> notifications = new ArrayDeque<>();

    public Notification create(String type, String title, String message, String featureId, String projectPath) {
        Notification notification = new Notification(type, title, message, featureId, projectPath, Instant.now());
        synchronized (notifications) {
            notifications.addFirst(notification);
            while (notifications.size() > MAX_NOTIFICATIONS) {
                notifications.removeLast();
            }
        }
        log.info("Notification [{}] {}: {}", type, title, message);
        return notification;
    }

    public List<Notification> recent(String projectPath) {
        synchronized (notifications) {
            return notifications.stream()
                    .filter(n -> projectPath == null || projectPath.equals(n.projectPath()))
                    .toList();
        }
    }
}
