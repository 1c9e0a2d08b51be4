package com.automaker.core.config;

import com.automaker.core.agent.AgentProvider;
import com.automaker.core.agent.SpringAiAgentProvider;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AutomakerConfig {

    /**
     * Runs feature executions. Unbounded because an execution may hold its thread for the whole
     * plan approval wait; the scheduler's per-project ceiling limits how many are admitted.
     */
    @Bean(name = "featureExecutor", destroyMethod = "shutdownNow")
    public ExecutorService featureExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "feature-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnProperty(name = "automaker.agent.provider", havingValue = "spring-ai", matchIfMissing = true)
    public AgentProvider springAiAgentProvider(ChatClient.Builder chatClientBuilder) {
        return new SpringAiAgentProvider(chatClientBuilder);
    }
}
