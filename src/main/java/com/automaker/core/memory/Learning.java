package com.automaker.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A non-obvious insight extracted from a finished feature run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Learning(
    String category,
    String type,
    String content,
    String context,
    String why,
    String rejected,
    String tradeoffs,
    String breaking
) {
}
