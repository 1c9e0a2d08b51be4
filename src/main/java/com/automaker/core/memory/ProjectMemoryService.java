package com.automaker.core.memory;

import com.automaker.core.persistence.AtomicJsonFiles;
import com.automaker.core.persistence.FeatureStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads project context ({@code .automaker/context/*.md}) and feature-relevant memory
 * ({@code .automaker/memory/*.md}) into a system prompt, and records learnings back into memory.
 * <p>
 * Memory relevance is scored by how many distinct terms of the feature's title and description
 * appear in a memory file.
 */
@Service
public class ProjectMemoryService {

    private static final Logger log = LoggerFactory.getLogger(ProjectMemoryService.class);

    static final int MAX_MEMORY_FILES = 5;
    private static final int MIN_TERM_LENGTH = 4;
    private static final String USAGE_FILE = "usage.json";

    private final AtomicJsonFiles files;

    public ProjectMemoryService(ObjectMapper objectMapper) {
        this.files = new AtomicJsonFiles(objectMapper, 0);
    }

    public ProjectContext loadContext(String projectPath, String title, String description) {
        StringBuilder prompt = new StringBuilder();

        List<Path> contextFiles = markdownFiles(FeatureStore.automakerDir(projectPath).resolve("context"));
        if (!contextFiles.isEmpty()) {
            prompt.append("# Project Context\n\n");
            for (Path file : contextFiles) {
                readQuietly(file).ifPresent(content -> prompt
                        .append("## ").append(file.getFileName()).append("\n\n")
                        .append(content.strip()).append("\n\n"));
            }
        }

        List<Path> memory = relevantMemory(projectPath, terms(title + " " + description));
        List<String> memoryNames = new ArrayList<>();
        if (!memory.isEmpty()) {
            prompt.append("# Project Memory\n\n");
            for (Path file : memory) {
                readQuietly(file).ifPresent(content -> {
                    memoryNames.add(file.getFileName().toString());
                    prompt.append("## ").append(file.getFileName()).append("\n\n")
                            .append(content.strip()).append("\n\n");
                });
            }
        }

        return new ProjectContext(prompt.toString().strip(), memoryNames);
    }

    /** Bumps load counters for memory files that were included in a successful run. */
    public void recordMemoryUsage(String projectPath, List<String> memoryFiles) {
        if (memoryFiles.isEmpty()) {
            return;
        }
        Path usagePath = memoryDir(projectPath).resolve(USAGE_FILE);
        Map<String, MemoryUsage> usage = new HashMap<>(files.readWithRecovery(usagePath,
                files.objectMapper().getTypeFactory().constructType(new TypeReference<Map<String, MemoryUsage>>() {}),
                Map.<String, MemoryUsage>of()).data());
        Instant now = Instant.now();
        for (String name : memoryFiles) {
            MemoryUsage previous = usage.get(name);
            int loads = previous != null ? previous.successfulLoads() + 1 : 1;
            usage.put(name, new MemoryUsage(loads, now));
        }
        files.write(usagePath, usage, false);
    }

    /** Appends a learning to {@code memory/<category>.md}. */
    public void appendLearning(String projectPath, Learning learning) {
        String category = learning.category() != null && !learning.category().isBlank()
                ? learning.category().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "-")
                : "general";
        Path file = memoryDir(projectPath).resolve(category + ".md");

        StringBuilder entry = new StringBuilder();
        entry.append("\n### ").append(learning.type() != null ? learning.type() : "learning")
                .append(": ").append(learning.content()).append('\n');
        appendField(entry, "Context", learning.context());
        appendField(entry, "Why", learning.why());
        appendField(entry, "Rejected", learning.rejected());
        appendField(entry, "Trade-offs", learning.tradeoffs());
        appendField(entry, "Breaking", learning.breaking());

        try {
            Files.createDirectories(file.getParent());
            if (!Files.exists(file)) {
                Files.writeString(file, "# " + category + "\n", StandardCharsets.UTF_8);
            }
            Files.writeString(file, entry.toString(), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to append learning to {}: {}", file, e.getMessage());
        }
    }

    record MemoryUsage(int successfulLoads, Instant lastUsed) {}

    private static void appendField(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append("- **").append(label).append(":** ").append(value).append('\n');
        }
    }

    private List<Path> relevantMemory(String projectPath, Set<String> terms) {
        if (terms.isEmpty()) {
            return List.of();
        }
        record Scored(Path file, long score) {}
        List<Scored> scored = new ArrayList<>();
        for (Path file : markdownFiles(memoryDir(projectPath))) {
            String content = readQuietly(file).orElse("").toLowerCase(Locale.ROOT)
                    + " " + file.getFileName().toString().toLowerCase(Locale.ROOT);
            long score = terms.stream().filter(content::contains).count();
            if (score > 0) {
                scored.add(new Scored(file, score));
            }
        }
        return scored.stream()
                .sorted(Comparator.comparingLong(Scored::score).reversed())
                .limit(MAX_MEMORY_FILES)
                .map(Scored::file)
                .toList();
    }

    static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() >= MIN_TERM_LENGTH) {
                terms.add(token);
            }
        }
        return terms;
    }

    private static Path memoryDir(String projectPath) {
        return FeatureStore.automakerDir(projectPath).resolve("memory");
    }

    private static List<Path> markdownFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(p -> p.getFileName().toString().endsWith(".md")).sorted().toList();
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private static Optional<String> readQuietly(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
