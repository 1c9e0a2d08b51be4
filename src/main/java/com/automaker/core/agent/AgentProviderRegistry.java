package com.automaker.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves which {@link AgentProvider} handles a model.
 */
@Service
public class AgentProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentProviderRegistry.class);

    private final List<AgentProvider> providers;

    public AgentProviderRegistry(List<AgentProvider> providers) {
        if (providers.isEmpty()) {
            throw new IllegalStateException("No agent provider configured");
        }
        this.providers = List.copyOf(providers);
        log.info("Agent providers available: {}", this.providers.stream().map(AgentProvider::name).toList());
    }

    public AgentProvider providerFor(String model) {
        for (AgentProvider provider : providers) {
            if (provider.supportsModel(model)) {
                return provider;
            }
        }
        log.warn("No provider claims model {}, using {}", model, providers.get(0).name());
        return providers.get(0);
    }
}
