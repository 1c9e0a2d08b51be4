package com.automaker.core.tasks;

import com.automaker.core.model.ParsedTask;
import com.automaker.core.prompt.PromptTemplates;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts plan content and {@code T###} tasks from agent output.
 * <p>
 * Tasks are read from a fenced {@code tasks} block, where {@code ## ...} headings set the
 * phase of the tasks below them. Without such a block, checklist lines of the form
 * {@code - [ ] T001: ...} anywhere in the content are used instead, without phases.
 */
public final class PlanTaskParser {

    private static final Pattern TASKS_BLOCK = Pattern.compile("```tasks\\s*([\\s\\S]*?)```");
    private static final Pattern FALLBACK_TASK_LINE = Pattern.compile("- \\[ \\] T\\d{3}:.*$", Pattern.MULTILINE);
    private static final Pattern PHASE_HEADING = Pattern.compile("^##\\s*(.+)$");
    private static final Pattern TASK_WITH_FILE =
            Pattern.compile("- \\[ \\] (T\\d{3}):\\s*([^|]+)(?:\\|\\s*File:\\s*(.+))?$");
    private static final Pattern TASK_SIMPLE = Pattern.compile("- \\[ \\] (T\\d{3}):\\s*(.+)$");
    private static final Pattern PHASE_NUMBER = Pattern.compile("Phase\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

    private PlanTaskParser() {}

    /** True once the agent has emitted the plan-complete marker. */
    public static boolean hasPlanMarker(String text) {
        return text != null && text.contains(PromptTemplates.SPEC_GENERATED_MARKER);
    }

    /** The plan is everything before the marker, trimmed. */
    public static String extractPlan(String text) {
        int idx = text.indexOf(PromptTemplates.SPEC_GENERATED_MARKER);
        return (idx >= 0 ? text.substring(0, idx) : text).trim();
    }

    public static List<ParsedTask> parseTasks(String content) {
        List<ParsedTask> tasks = new ArrayList<>();
        if (content == null) {
            return tasks;
        }

        Matcher block = TASKS_BLOCK.matcher(content);
        if (!block.find()) {
            Matcher lines = FALLBACK_TASK_LINE.matcher(content);
            while (lines.find()) {
                parseTaskLine(lines.group(), null).ifPresent(tasks::add);
            }
            return tasks;
        }

        String currentPhase = null;
        for (String line : block.group(1).split("\n")) {
            String trimmed = line.trim();
            Matcher phase = PHASE_HEADING.matcher(trimmed);
            if (phase.matches()) {
                currentPhase = phase.group(1).trim();
                continue;
            }
            if (trimmed.startsWith("- [ ]")) {
                parseTaskLine(trimmed, currentPhase).ifPresent(tasks::add);
            }
        }
        return tasks;
    }

    static Optional<ParsedTask> parseTaskLine(String line, String phase) {
        Matcher withFile = TASK_WITH_FILE.matcher(line);
        if (withFile.find()) {
            String filePath = withFile.group(3) != null ? withFile.group(3).trim() : null;
            return Optional.of(ParsedTask.pending(withFile.group(1), withFile.group(2).trim(), filePath, phase));
        }
        Matcher simple = TASK_SIMPLE.matcher(line);
        if (simple.find()) {
            return Optional.of(ParsedTask.pending(simple.group(1), simple.group(2).trim(), null, phase));
        }
        return Optional.empty();
    }

    /** Phase number from a heading such as {@code Phase 2: Core}, if present. */
    public static Optional<Integer> phaseNumber(String phase) {
        if (phase == null) {
            return Optional.empty();
        }
        Matcher m = PHASE_NUMBER.matcher(phase);
        return m.find() ? Optional.of(Integer.parseInt(m.group(1))) : Optional.empty();
    }
}
