package com.automaker.core.notification;

import java.time.Instant;

public record Notification(
    String type,
    String title,
    String message,
    String featureId,
    String projectPath,
    Instant createdAt
) {
}
