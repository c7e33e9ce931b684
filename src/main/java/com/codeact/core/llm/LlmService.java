package com.codeact.core.llm;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.model.PromptPayload;
import com.codeact.core.model.Turn;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wraps Spring AI's {@link ChatClient} for the agent loop.
 * <p>
 * Two call shapes are offered: {@link #complete} sends a whole conversation and returns
 * the raw reply text, {@link #structuredCall} asks for JSON matching a Java type and
 * deserializes it with {@link BeanOutputConverter}. Both run the blocking HTTP call on a
 * worker thread so a per-call timeout and task cancellation can abandon it, and both
 * retry transient provider failures with exponential backoff.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper;
    private final ExecutorService callExecutor;

    public LlmService(ChatClient.Builder builder,
                      LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        var threadCounter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "llm-call-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("LlmService initialized, base-url: {}, model: {}", baseUrl,
                properties.hasModel() ? properties.getModel() : "(provider default)");
    }

    @PreDestroy
    void shutdown() {
        callExecutor.shutdownNow();
    }

    /**
     * Sends the system prompt and conversation history and returns the reply text.
     * Observation turns are sent as user messages wrapped in {@code <observation>} tags.
     *
     * @return the reply, or an empty string when the model returned no content
     * @throws LlmProviderException   when the provider fails after retries
     * @throws TaskCancelledException when the token is cancelled first
     */
    public String complete(PromptPayload payload, CancellationToken token) {
        List<Message> messages = toMessages(payload.history());
        log.debug("Completion requested with {} message(s)", messages.size());
        long start = System.currentTimeMillis();
        String content = withRetries("completion", token, () -> chatClient.prompt()
                .options(chatOptions())
                .system(payload.systemPrompt())
                .messages(messages)
                .call()
                .content());
        log.info("Completion received ({}s, {} chars)",
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0),
                content == null ? 0 : content.length());
        return content == null ? "" : content;
    }

    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        return structuredCall(systemPrompt, userPrompt, outputType, CancellationToken.none());
    }

    /**
     * Sends a system + user prompt and deserializes the JSON reply into {@code outputType}.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when the content is not valid JSON for the type
     * @throws LlmProviderException      when the provider fails after retries
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType,
                                CancellationToken token) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = withRetries(outputType.getSimpleName(), token, () -> chatClient.prompt()
                .options(chatOptions())
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content());
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Fallback parsing with lenient Jackson settings, tolerating markdown code fences.
     */
    private <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private <R> R withRetries(String label, CancellationToken token, Supplier<R> call) {
        int attempt = 0;
        while (true) {
            token.throwIfCancelled();
            try {
                return callOnce(call, token);
            } catch (LlmProviderException e) {
                if (!e.isTransientFailure() || attempt >= properties.getMaxRetries()) {
                    log.error("LLM {} call failed ({}), giving up after {} attempt(s): {}",
                            label, e.kind(), attempt + 1, e.getMessage());
                    throw e;
                }
                Duration backoff = backoffFor(attempt);
                attempt++;
                log.warn("LLM {} call failed ({}), retry {}/{} in {}ms",
                        label, e.kind(), attempt, properties.getMaxRetries(), backoff.toMillis());
                if (token.awaitCancellation(backoff)) {
                    throw new TaskCancelledException("Task cancelled while waiting to retry the model call");
                }
            }
        }
    }

    Duration backoffFor(int attempt) {
        long initial = Math.max(0, properties.getInitialBackoffMillis());
        long delay = initial << Math.min(attempt, 20);
        return Duration.ofMillis(Math.min(delay, properties.getMaxBackoffMillis()));
    }

    private <R> R callOnce(Supplier<R> call, CancellationToken token) {
        Future<R> future = callExecutor.submit(call::get);
        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            return future.get(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (CancellationException e) {
            throw new TaskCancelledException("Model call abandoned because the task was cancelled");
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LlmProviderException(ProviderErrorKind.TIMEOUT, true,
                    "Model call exceeded " + properties.getRequestTimeoutSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while waiting for the model");
        } catch (ExecutionException e) {
            throw ProviderErrorClassifier.classify(e.getCause() != null ? e.getCause() : e);
        }
    }

    private ChatOptions chatOptions() {
        return ChatOptions.builder()
                .model(properties.hasModel() ? properties.getModel() : null)
                .temperature(properties.getTemperature())
                .build();
    }

    static List<Message> toMessages(List<Turn> history) {
        var messages = new ArrayList<Message>(history.size());
        for (Turn turn : history) {
            messages.add(switch (turn.role()) {
                case USER -> new UserMessage(turn.content());
                case ASSISTANT -> new AssistantMessage(turn.content());
                case OBSERVATION -> new UserMessage("<observation>\n" + turn.content() + "\n</observation>");
                case SYSTEM -> new SystemMessage(turn.content());
            });
        }
        return messages;
    }
}
