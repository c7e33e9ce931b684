package com.codeact.core.llm;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps exceptions thrown by the chat client onto {@link LlmProviderException}s.
 */
public final class ProviderErrorClassifier {

    private static final Pattern AUTHENTICATION = Pattern.compile(
            "\\b40[13]\\b|unauthorized|forbidden|invalid api key|incorrect api key|authentication");
    private static final Pattern QUOTA = Pattern.compile("insufficient_quota|\\bquota\\b");
    private static final Pattern RATE_LIMIT = Pattern.compile("\\b429\\b|rate limit|too many requests");

    private ProviderErrorClassifier() {}

    /**
     * Typed causes are checked before message text; credential failures are only recognised
     * on errors the provider itself reported as non-transient.
     */
    public static LlmProviderException classify(Throwable error) {
        if (error instanceof LlmProviderException already) {
            return already;
        }
        String message = messageChain(error);
        String lower = message.toLowerCase(Locale.ROOT);

        if (hasCause(error, TimeoutException.class)) {
            return new LlmProviderException(ProviderErrorKind.TIMEOUT, true,
                    "Model call timed out: " + message, error);
        }
        if (hasCause(error, IOException.class)) {
            return new LlmProviderException(ProviderErrorKind.NETWORK, true,
                    "Could not reach the model provider: " + message, error);
        }
        if (QUOTA.matcher(lower).find()) {
            return new LlmProviderException(ProviderErrorKind.QUOTA, false,
                    "Model provider quota exhausted: " + message, error);
        }
        if (RATE_LIMIT.matcher(lower).find()) {
            return new LlmProviderException(ProviderErrorKind.RATE_LIMIT, true,
                    "Model provider rate limit hit: " + message, error);
        }
        Throwable rejected = causeOf(error, NonTransientAiException.class);
        if (rejected != null) {
            if (AUTHENTICATION.matcher(messageChain(rejected).toLowerCase(Locale.ROOT)).find()) {
                return new LlmProviderException(ProviderErrorKind.AUTHENTICATION, false,
                        "Model provider rejected the credentials: " + message, error);
            }
            return new LlmProviderException(ProviderErrorKind.UNKNOWN, false,
                    "Model provider error: " + message, error);
        }
        if (hasCause(error, TransientAiException.class)) {
            return new LlmProviderException(ProviderErrorKind.UNKNOWN, true,
                    "Transient model provider error: " + message, error);
        }
        return new LlmProviderException(ProviderErrorKind.UNKNOWN, false,
                "Unexpected model call failure: " + message, error);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        return causeOf(error, type) != null;
    }

    private static Throwable causeOf(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return t;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static String messageChain(Throwable error) {
        var sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                if (sb.length() > 0) {
                    sb.append(" <- ");
                }
                sb.append(t.getMessage());
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return sb.length() > 0 ? sb.toString() : error.getClass().getSimpleName();
    }
}
