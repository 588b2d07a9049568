package com.tessera.core.backend;

import com.tessera.core.model.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Reasoning backend on Spring AI's {@link ChatClient} streaming API.
 * <p>
 * The content flux is bridged to a blocking stream; closing the stream cancels the
 * subscription and with it the HTTP exchange. Normal completion appends an END chunk,
 * so a stream that stops without END was cut off.
 */
@Service
public class SpringAiReasoningBackend implements ReasoningBackend {

    private static final Logger log = LoggerFactory.getLogger(SpringAiReasoningBackend.class);

    private static final int PREFETCH = 32;

    private final ChatClient chatClient;
    private final PromptRenderer promptRenderer;
    private final String baseUrl;

    public SpringAiReasoningBackend(ChatClient.Builder builder, PromptRenderer promptRenderer,
                                    @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.promptRenderer = promptRenderer;
        this.baseUrl = baseUrl;
        log.info("Reasoning backend initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public BackendStream stream(String systemPrompt, ExecutionContext context, String userRequest) {
        String userPrompt = promptRenderer.render(context, userRequest);
        log.debug("Streaming /{} ({} chars of prompt)", context.activeCommand().verb(), userPrompt.length());

        var request = chatClient.prompt().system(systemPrompt).user(userPrompt);
        context.activeCommand().flagText("model")
                .ifPresent(model -> request.options(ChatOptions.builder().model(model).build()));

        Flux<BackendChunk> chunks;
        try {
            chunks = request.stream().content()
                    .filter(text -> text != null && !text.isEmpty())
                    .map(BackendChunk::text)
                    .onErrorMap(e -> !(e instanceof BackendException), SpringAiReasoningBackend::classify)
                    .concatWith(Flux.just(BackendChunk.end()));
        } catch (RuntimeException e) {
            throw classify(e);
        }
        Stream<BackendChunk> stream = chunks.toStream(PREFETCH);
        return BackendStream.of(stream);
    }

    @Override
    public String describe() {
        return "Spring AI ChatClient (" + baseUrl + ")";
    }

    static BackendException classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                    || t instanceof UnknownHostException
                    || t instanceof UnresolvedAddressException
                    || t instanceof TimeoutException) {
                return new BackendException(BackendException.Kind.UNREACHABLE,
                        "Reasoning backend unreachable: " + t.getMessage(), error);
            }
        }
        return new BackendException(BackendException.Kind.PROTOCOL_ERROR,
                "Reasoning backend error: " + error.getMessage(), error);
    }
}
