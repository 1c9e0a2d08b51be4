package com.automaker.core.memory;

import com.automaker.core.agent.ScriptedAgentProvider;
import com.automaker.core.model.Feature;
import com.automaker.core.prompt.PromptBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LearningExtractorTest {

    private final ProjectMemoryService memory = mock(ProjectMemoryService.class);
    private final LearningExtractor extractor =
            new LearningExtractor(new PromptBuilder(), memory, new ObjectMapper());

    // -- JSON extraction ---

    @Nested
    @DisplayName("extractJson")
    class ExtractJsonTests {

        @Test
        @DisplayName("prefers a json fence")
        void fence() {
            String reply = "Here:\n```json\n{\"learnings\": []}\n```\nthanks";

            assertEquals(Optional.of("{\"learnings\": []}"), LearningExtractor.extractJson(reply));
        }

        @Test
        @DisplayName("finds the balanced object around the learnings key")
        void balancedObject() {
            String reply = "Sure! {\"learnings\": [{\"content\": \"x {y}\"}]} done";

            assertEquals(Optional.of("{\"learnings\": [{\"content\": \"x {y}\"}]}"),
                    LearningExtractor.extractJson(reply));
        }

        @Test
        @DisplayName("no learnings key yields nothing")
        void nothing() {
            assertTrue(LearningExtractor.extractJson("no json here").isEmpty());
            assertTrue(LearningExtractor.extractJson(null).isEmpty());
        }
    }

    // -- parsing ---

    @Test
    @DisplayName("drops empty learnings and normalises unknown types")
    void parsesLearnings() {
        List<Learning> learnings = extractor.parseLearnings("""
                {"learnings": [
                  {"category": "database", "type": "gotcha", "content": "Use transactions", "extra": 1},
                  {"category": "ui", "type": "whatever", "content": "Debounce input"},
                  {"category": "ui", "content": ""}
                ]}""");

        assertEquals(2, learnings.size());
        assertEquals("gotcha", learnings.get(0).type());
        assertEquals("learning", learnings.get(1).type());
    }

    @Test
    @DisplayName("malformed JSON yields no learnings")
    void malformed() {
        assertTrue(extractor.parseLearnings("{\"learnings\": [oops").isEmpty());
    }

    // -- extract and record ---

    @Test
    @DisplayName("short output is not sent to the agent")
    void shortOutput() {
        ScriptedAgentProvider provider = new ScriptedAgentProvider();

        assertEquals(0, extractor.extractAndRecord("/p", new Feature("F1", "d", "verified"), "short",
                provider, "gpt-4o"));
        assertTrue(provider.queries().isEmpty());
    }

    @Test
    @DisplayName("records every parsed learning")
    void records() {
        ScriptedAgentProvider provider = new ScriptedAgentProvider()
                .replyText("{\"learnings\": [{\"category\": \"api\", \"type\": \"decision\", \"content\": \"REST\"}]}");

        int recorded = extractor.extractAndRecord("/p", new Feature("F1", "Add API", "verified"),
                "x".repeat(200), provider, "gpt-4o");

        assertEquals(1, recorded);
        verify(memory).appendLearning(eq("/p"), any(Learning.class));
    }

    @Test
    @DisplayName("agent failures are swallowed")
    void failuresSwallowed() {
        ScriptedAgentProvider provider = new ScriptedAgentProvider().replyWith(q -> {
            throw new IllegalStateException("backend down");
        });

        assertEquals(0, extractor.extractAndRecord("/p", new Feature("F1", "Add API", "verified"),
                "x".repeat(200), provider, "gpt-4o"));
        verifyNoInteractions(memory);
    }
}
