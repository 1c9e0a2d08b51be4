package com.automaker.core.prompt;

import java.util.Map;

/**
 * Prompt text used by the orchestrator. Placeholders use {@code {{name}}} syntax and are
 * filled by {@link #render(String, Map)}.
 */
public final class PromptTemplates {

    private PromptTemplates() {}

    public static final String SPEC_GENERATED_MARKER = "[SPEC_GENERATED]";

    public static final String PLANNING_LITE = """
            ## Planning Phase (Lite Mode)

            Before writing code, outline your approach briefly:
            1. **Goal**: what this change accomplishes (one sentence)
            2. **Approach**: how you will implement it (2-3 sentences)
            3. **Files**: files you expect to touch
            4. **Tasks**: a short ordered checklist
            5. **Risks**: anything that could go wrong

            Then proceed directly to the implementation.
            """;

    public static final String PLANNING_LITE_WITH_APPROVAL = """
            ## Planning Phase (Lite Mode)

            IMPORTANT: Output the outline below directly, without exploration notes or tool narration.

            1. **Goal**: what this change accomplishes (one sentence)
            2. **Approach**: how you will implement it (2-3 sentences)
            3. **Files**: files you expect to touch
            4. **Tasks**:
               ```tasks
               - [ ] T001: [Description] | File: [path/to/file]
               - [ ] T002: [Description] | File: [path/to/file]
               ```
            5. **Risks**: anything that could go wrong

            After the outline, output on its own line:
            "[SPEC_GENERATED] Please review the planning outline above. Reply with 'approved' to proceed or provide feedback for revisions."

            Do not start implementing until the outline is approved.
            """;

    public static final String PLANNING_SPEC = """
            ## Specification Phase (Spec Mode)

            IMPORTANT: Analyze the codebase silently, then output only the specification below.

            1. **Problem**: the problem being solved, from the user's perspective
            2. **Solution**: the approach in 1-2 sentences
            3. **Acceptance Criteria**: 3-5 items in GIVEN-WHEN-THEN form
            4. **Files to Modify**: a table of file, purpose and action
            5. **Implementation Tasks**, in exactly this format:
               ```tasks
               - [ ] T001: [Description] | File: [path/to/file]
               - [ ] T002: [Description] | File: [path/to/file]
               ```
               Number tasks sequentially (T001, T002, ...) and order them by dependency.
            6. **Verification**: how to confirm the feature works

            After the specification, output on its own line:
            "[SPEC_GENERATED] Please review the specification above. Reply with 'approved' to proceed or provide feedback for revisions."

            Do not start implementing until the specification is approved.
            """;

    public static final String PLANNING_FULL = """
            ## Full Specification Phase (Full SDD Mode)

            IMPORTANT: Analyze the codebase silently, then output only the specification below.

            1. **Problem Statement**: 2-3 sentences from the user's perspective
            2. **User Story**: As a [user], I want [goal], so that [benefit]
            3. **Acceptance Criteria**: happy path, edge cases and error handling in GIVEN-WHEN-THEN form
            4. **Technical Context**: affected files, dependencies, constraints, patterns to follow
            5. **Non-Goals**: what this feature does not include
            6. **Implementation Tasks**, grouped by phase, in exactly this format:
               ```tasks
               ## Phase 1: Foundation
               - [ ] T001: [Description] | File: [path/to/file]

               ## Phase 2: Core Implementation
               - [ ] T002: [Description] | File: [path/to/file]

               ## Phase 3: Integration & Testing
               - [ ] T003: [Description] | File: [path/to/file]
               ```
               Number tasks sequentially across phases.
            7. **Success Metrics**: measurable completion criteria
            8. **Risks & Mitigations**

            After the specification, output on its own line:
            "[SPEC_GENERATED] Please review the comprehensive specification above. Reply with 'approved' to proceed or provide feedback for revisions."

            Do not start implementing until the specification is approved.
            """;

    public static final String FEATURE_REQUEST_SEPARATOR = "\n\n---\n\n## Feature Request\n\n";

    public static final String IMPLEMENTATION_INSTRUCTIONS = """
            ## Instructions

            Implement this feature by:
            1. Exploring the codebase to understand its structure
            2. Planning your implementation approach
            3. Writing the necessary code changes
            4. Following the existing patterns and conventions

            When done, wrap your final summary in <summary> tags:

            <summary>
            ## Summary: [Feature Title]

            ### Changes Implemented
            - [List of changes made]

            ### Files Modified
            - [List of files]

            ### Notes for Developer
            - [Any important notes]
            </summary>""";

    public static final String VERIFICATION_INSTRUCTIONS = """
            ## Verification (REQUIRED)

            After implementing the feature, verify it works:
            1. Write a temporary test that exercises the new behavior
            2. Run it and fix the implementation until it passes
            3. Delete the temporary test afterwards

            Include a "### Verification Status" section in your summary describing how the feature was verified.""";

    public static final String TASK_PROMPT = """
            # Task Execution: {{taskId}}

            You are executing one task of a larger, approved feature plan.

            ## Your Current Task

            **Task ID:** {{taskId}}
            **Description:** {{taskDescription}}
            **Primary File:** {{taskFilePath}}
            **Phase:** {{taskPhase}}

            ## Context

            {{completedTasks}}
            {{remainingTasks}}
            {{userFeedback}}
            ## Approved Plan

            {{planContent}}

            ## Instructions

            1. Focus only on task {{taskId}}: "{{taskDescription}}"
            2. Do not work on other tasks
            3. Follow the existing codebase patterns
            4. When done, summarize what you implemented

            Begin implementing task {{taskId}} now.""";

    public static final String CONTINUATION_AFTER_APPROVAL = """
            The plan/specification has been approved. Now implement it.
            {{userFeedback}}
            ## Approved Plan

            {{approvedPlan}}

            ## Instructions

            Implement all the changes described in the plan above.""";

    public static final String PLAN_REVISION = """
            The user has requested revisions to the plan/specification.

            ## Previous Plan (v{{planVersion}})
            {{previousPlan}}

            ## User Feedback
            {{userFeedback}}

            ## Instructions
            Regenerate the specification incorporating the user's feedback.
            Keep the same format, including the ```tasks block.
            After the revised specification, output:
            "[SPEC_GENERATED] Please review the revised specification above."
            """;

    public static final String RESUME_FEATURE = """
            ## Continuing Feature Implementation

            {{featurePrompt}}

            ## Previous Context
            The following is the output of a previous implementation attempt. Continue from where it left off:

            {{previousContext}}

            ## Instructions
            Review the previous work and continue the implementation. If the feature appears complete, verify that it works.""";

    public static final String FOLLOW_UP = """
            ## Follow-up on Feature Implementation

            {{featurePrompt}}

            ## Previous Agent Work
            {{previousContext}}

            ## Follow-up Instructions
            {{followUpInstructions}}

            ## Task
            Address the follow-up instructions above. Review the previous work and make the requested changes or fixes.""";

    public static final String PIPELINE_STEP = """
            ## Pipeline Step: {{stepName}}

            This is an automated pipeline step following the initial feature implementation.

            ### Feature Context
            {{featurePrompt}}

            ### Previous Work
            The following is the output from the previous work on this feature:

            {{previousContext}}

            ### Pipeline Step Instructions
            {{stepInstructions}}

            ### Task
            Complete the pipeline step instructions above. Review the previous work and apply the required changes or actions.""";

    public static final String LEARNING_EXTRACTION_SYSTEM = "You are a JSON extraction assistant. Respond with "
            + "ONLY valid JSON, no explanations and no markdown. Extract learnings from the provided "
            + "implementation context and return them as JSON.";

    public static final String LEARNING_EXTRACTION_USER = """
            Analyze this implementation and return ONLY JSON with learnings.

            Feature: "{{featureTitle}}"

            Implementation log:
            {{implementationLog}}

            Capture only non-obvious learnings:
            - DECISIONS: why this approach over the alternatives, and what breaks if it changes
            - GOTCHAS: what was unexpected, its root cause, and how to avoid it
            - PATTERNS: why this pattern, what problem it solves, and its trade-offs

            JSON format only:
            {"learnings": [{
              "category": "architecture|api|ui|database|auth|testing|performance|security|gotchas",
              "type": "decision|gotcha|pattern",
              "content": "What was done/learned",
              "context": "Problem being solved",
              "why": "Reasoning behind the approach",
              "rejected": "Alternative considered and why it was rejected",
              "tradeoffs": "What became easier or harder",
              "breaking": "What breaks if this is changed or removed"
            }]}

            If nothing is notable, return {"learnings": []}""";

    /** Replaces every {@code {{key}}} with its value; null values become empty strings. */
    public static String render(String template, Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue() != null ? entry.getValue() : "";
            result = result.replace("{{" + entry.getKey() + "}}", value);
        }
        return result;
    }
}
