package com.automaker.core.memory;

import java.util.List;

/**
 * Context and memory loaded for one feature run.
 *
 * @param formattedPrompt system prompt text combining context files and relevant memory
 * @param memoryFiles     names of the memory files that were included
 */
public record ProjectContext(String formattedPrompt, List<String> memoryFiles) {

    public static ProjectContext empty() {
        return new ProjectContext("", List.of());
    }
}
