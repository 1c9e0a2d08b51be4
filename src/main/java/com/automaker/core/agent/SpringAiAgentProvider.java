package com.automaker.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;

import java.util.stream.Stream;

/**
 * {@link AgentProvider} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Streams the model's text as {@link AgentMessage.Type#TEXT} events and closes with a
 * {@link AgentMessage.Type#RESULT}. Errors from the model propagate as exceptions while
 * the stream is consumed.
 */
public class SpringAiAgentProvider implements AgentProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiAgentProvider.class);

    private final ChatClient chatClient;

    public SpringAiAgentProvider(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public String name() {
        return "spring-ai";
    }

    @Override
    public Stream<AgentMessage> executeQuery(AgentQuery query) {
        log.info("Agent query started (model={}, workDir={})", query.model(), query.workDir());
        var request = chatClient.prompt()
                .options(OpenAiChatOptions.builder().model(query.model()).build())
                .user(query.prompt());
        if (query.systemPrompt() != null && !query.systemPrompt().isBlank()) {
            request = request.system(query.systemPrompt());
        }
        var flux = request.stream().content();
        if (query.cancellation() != null) {
            flux = flux.takeWhile(chunk -> !query.cancellation().isCancelled());
        }
        Stream<AgentMessage> textStream = flux.toStream().map(AgentMessage::text);
        return Stream.concat(textStream, Stream.of(AgentMessage.result("")))
                .onClose(() -> log.debug("Agent stream closed (model={})", query.model()));
    }
}
