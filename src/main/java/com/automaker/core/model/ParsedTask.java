package com.automaker.core.model;

import java.io.Serializable;

/**
 * A single task extracted from a generated plan.
 *
 * @param id          task identifier, e.g. {@code T001}
 * @param description what the task should accomplish
 * @param filePath    primary file affected, may be null
 * @param phase       phase heading the task was listed under, may be null
 * @param status      {@code pending}, {@code in_progress} or {@code completed}
 */
public record ParsedTask(
    String id,
    String description,
    String filePath,
    String phase,
    String status
) implements Serializable {

    public static ParsedTask pending(String id, String description, String filePath, String phase) {
        return new ParsedTask(id, description, filePath, phase, "pending");
    }
}
