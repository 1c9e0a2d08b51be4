package com.automaker.core.memory;

import com.automaker.core.agent.AgentProvider;
import com.automaker.core.agent.AgentQuery;
import com.automaker.core.model.Feature;
import com.automaker.core.prompt.PromptBuilder;
import com.automaker.core.prompt.PromptTemplates;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the agent for non-obvious learnings from a finished run and records them in project memory.
 * Runs best-effort: every failure is logged and swallowed.
 */
@Service
public class LearningExtractor {

    private static final Logger log = LoggerFactory.getLogger(LearningExtractor.class);

    static final int MIN_OUTPUT_LENGTH = 100;
    static final int MAX_LOG_CHARS = 10_000;
    private static final Set<String> VALID_TYPES = Set.of("decision", "learning", "pattern", "gotcha");
    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*([\\s\\S]*?)```");

    private final PromptBuilder promptBuilder;
    private final ProjectMemoryService memoryService;
    private final ObjectMapper objectMapper;

    public LearningExtractor(PromptBuilder promptBuilder, ProjectMemoryService memoryService, ObjectMapper objectMapper) {
        this.promptBuilder = promptBuilder;
        this.memoryService = memoryService;
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @return the number of learnings recorded
     */
    public int extractAndRecord(String projectPath, Feature feature, String agentOutput,
                                AgentProvider provider, String model) {
        if (agentOutput == null || agentOutput.length() < MIN_OUTPUT_LENGTH) {
            return 0;
        }
        try {
            String implementationLog = agentOutput.length() > MAX_LOG_CHARS
                    ? agentOutput.substring(agentOutput.length() - MAX_LOG_CHARS)
                    : agentOutput;
            String prompt = promptBuilder.learningExtractionPrompt(feature.displayTitle(), implementationLog);
            String response = provider.simpleQuery(new AgentQuery(prompt, model, Path.of(projectPath),
                    PromptTemplates.LEARNING_EXTRACTION_SYSTEM, List.of(), null));

            List<Learning> learnings = parseLearnings(response);
            for (Learning learning : learnings) {
                memoryService.appendLearning(projectPath, learning);
            }
            if (!learnings.isEmpty()) {
                log.info("Recorded {} learning(s) from feature {}", learnings.size(), feature.getId());
            }
            return learnings.size();
        } catch (RuntimeException e) {
            log.warn("Failed to extract learnings from feature {}: {}", feature.getId(), e.getMessage());
            return 0;
        }
    }

    List<Learning> parseLearnings(String response) {
        Optional<String> json = extractJson(response);
        if (json.isEmpty()) {
            log.debug("No learnings JSON found in response");
            return List.of();
        }
        List<Learning> learnings = new ArrayList<>();
        try {
            JsonNode array = objectMapper.readTree(json.get()).path("learnings");
            if (!array.isArray()) {
                return List.of();
            }
            for (JsonNode node : array) {
                Learning raw = objectMapper.treeToValue(node, Learning.class);
                if (raw.content() == null || raw.content().isBlank()) {
                    continue;
                }
                String type = raw.type() != null && VALID_TYPES.contains(raw.type()) ? raw.type() : "learning";
                learnings.add(new Learning(raw.category(), type, raw.content(), raw.context(), raw.why(),
                        raw.rejected(), raw.tradeoffs(), raw.breaking()));
            }
        } catch (Exception e) {
            log.debug("Could not parse learnings JSON: {}", e.getMessage());
            return List.of();
        }
        return learnings;
    }

    /**
     * Finds the learnings object in a model reply: a {@code json} fence first, otherwise the
     * brace-balanced object enclosing the {@code "learnings"} key.
     */
    static Optional<String> extractJson(String response) {
        if (response == null) {
            return Optional.empty();
        }
        Matcher fence = JSON_FENCE.matcher(response);
        if (fence.find()) {
            return Optional.of(fence.group(1).trim());
        }
        int keyIdx = response.indexOf("\"learnings\"");
        if (keyIdx < 0) {
            return Optional.empty();
        }
        int start = response.lastIndexOf('{', keyIdx);
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        for (int i = start; i < response.length(); i++) {
            char c = response.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(response.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
