package com.automaker.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProjectMemoryServiceTest {

    @TempDir
    Path projectDir;

    private ProjectMemoryService service;
    private String projectPath;

    @BeforeEach
    void setUp() {
        service = new ProjectMemoryService(new ObjectMapper().findAndRegisterModules());
        projectPath = projectDir.toString();
    }

    private void write(String relative, String content) throws Exception {
        Path file = projectDir.resolve(".automaker").resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("empty project yields an empty context")
    void emptyProject() {
        ProjectContext context = service.loadContext(projectPath, "Add login", "OAuth login");

        assertEquals("", context.formattedPrompt());
        assertTrue(context.memoryFiles().isEmpty());
    }

    @Test
    @DisplayName("includes context files and only relevant memory")
    void loadsContextAndRelevantMemory() throws Exception {
        write("context/conventions.md", "Use tabs.");
        write("memory/auth.md", "Login tokens expire after an hour.");
        write("memory/styling.md", "Prefer CSS modules.");

        ProjectContext context = service.loadContext(projectPath, "Add login", "Login with tokens");

        assertTrue(context.formattedPrompt().startsWith("# Project Context"));
        assertTrue(context.formattedPrompt().contains("Use tabs."));
        assertTrue(context.formattedPrompt().contains("Login tokens expire"));
        assertFalse(context.formattedPrompt().contains("CSS modules"));
        assertEquals(List.of("auth.md"), context.memoryFiles());
    }

    @Test
    @DisplayName("appends learnings under a sanitised category file")
    void appendsLearning() throws Exception {
        service.appendLearning(projectPath, new Learning("Data Base", "gotcha", "Close cursors",
                "Seen in import job", null, null, null, null));

        String content = Files.readString(projectDir.resolve(".automaker/memory/data-base.md"));
        assertTrue(content.startsWith("# data-base\n"));
        assertTrue(content.contains("### gotcha: Close cursors"));
        assertTrue(content.contains("- **Context:** Seen in import job"));
        assertFalse(content.contains("Why"));
    }

    @Test
    @DisplayName("records memory usage counts")
    void recordsUsage() throws Exception {
        service.recordMemoryUsage(projectPath, List.of("auth.md"));
        service.recordMemoryUsage(projectPath, List.of("auth.md"));

        String usage = Files.readString(projectDir.resolve(".automaker/memory/usage.json"));
        assertTrue(usage.contains("\"successfulLoads\" : 2"));
    }

    @Test
    @DisplayName("terms keep words of four or more characters")
    void terms() {
        assertEquals(Set.of("login", "with", "oauth"), ProjectMemoryService.terms("Add login with OAuth"));
    }
}
