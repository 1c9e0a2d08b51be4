package com.automaker.core.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AgentProviderRegistryTest {

    private static AgentProvider claiming(String name, String prefix) {
        return new AgentProvider() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean supportsModel(String model) {
                return model != null && model.startsWith(prefix);
            }

            @Override
            public Stream<AgentMessage> executeQuery(AgentQuery query) {
                return Stream.empty();
            }
        };
    }

    @Test
    @DisplayName("picks the first provider that claims the model")
    void picksClaimingProvider() {
        AgentProviderRegistry registry = new AgentProviderRegistry(List.of(
                claiming("openai", "gpt-"), claiming("anthropic", "claude-")));

        assertEquals("anthropic", registry.providerFor("claude-sonnet").name());
        assertEquals("openai", registry.providerFor("gpt-4o").name());
    }

    @Test
    @DisplayName("falls back to the first provider for unclaimed models")
    void fallsBack() {
        AgentProviderRegistry registry = new AgentProviderRegistry(List.of(
                claiming("openai", "gpt-"), claiming("anthropic", "claude-")));

        assertEquals("openai", registry.providerFor("llama3").name());
    }

    @Test
    @DisplayName("refuses to start without providers")
    void requiresProvider() {
        assertThrows(IllegalStateException.class, () -> new AgentProviderRegistry(List.of()));
    }
}
