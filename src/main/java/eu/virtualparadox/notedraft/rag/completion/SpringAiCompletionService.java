package eu.virtualparadox.notedraft.rag.completion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link CompletionService} on top of a Spring AI {@link ChatModel}. Instructions
 * become the system message; the expected JSON shape is appended to them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpringAiCompletionService implements CompletionService {

    private final ChatModel chatModel;
    private final UsageTracker usageTracker;

    @Override
    public String complete(final CompletionRequest request) {
        final ChatResponse response;
        try {
            response = chatModel.call(toPrompt(request));
        }
        catch (RuntimeException e) {
            throw new ModelCallException("Model call failed: " + e.getMessage(), e);
        }
        usageTracker.record(response);
        final String text = textOf(response);
        log.debug("Model answered with {} chars", text.length());
        return text;
    }

    @Override
    public Flux<String> stream(final CompletionRequest request) {
        final AtomicReference<ChatResponse> last = new AtomicReference<>();
        return Flux.defer(() -> chatModel.stream(toPrompt(request)))
                .doOnNext(last::set)
                .doOnComplete(() -> usageTracker.record(last.get()))
                .map(SpringAiCompletionService::textOf)
                .filter(delta -> !delta.isEmpty())
                .onErrorMap(e -> !(e instanceof ModelCallException),
                        e -> new ModelCallException("Model stream failed: " + e.getMessage(), e));
    }

    Prompt toPrompt(final CompletionRequest request) {
        String instructions = request.instructions();
        if (request.expectsJson()) {
            instructions = instructions + "\n\nRespond with a single JSON object matching this shape:\n"
                    + request.responseSchema();
        }
        final List<Message> messages = List.of(new SystemMessage(instructions), new UserMessage(request.input()));
        final ChatOptions options = ChatOptions.builder()
                .model(request.model())
                .maxTokens(request.maxOutputTokens())
                .build();
        return new Prompt(messages, options);
    }

    private static String textOf(final ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        final String text = response.getResult().getOutput().getText();
        return text == null ? "" : text;
    }
}
