package com.codeact.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorClassifierTest {

    @Test
    @DisplayName("credential errors are fatal authentication failures")
    void authentication() {
        var e = ProviderErrorClassifier.classify(new NonTransientAiException("HTTP 401 Unauthorized"));

        assertEquals(ProviderErrorKind.AUTHENTICATION, e.kind());
        assertFalse(e.isTransientFailure());
    }

    @Test
    @DisplayName("exhausted quota is fatal even though it arrives as a 429")
    void quota() {
        var e = ProviderErrorClassifier.classify(
                new TransientAiException("429 - You exceeded your current quota (insufficient_quota)"));

        assertEquals(ProviderErrorKind.QUOTA, e.kind());
        assertFalse(e.isTransientFailure());
    }

    @Test
    @DisplayName("rate limits are retried")
    void rateLimit() {
        var e = ProviderErrorClassifier.classify(new TransientAiException("429 Too Many Requests"));

        assertEquals(ProviderErrorKind.RATE_LIMIT, e.kind());
        assertTrue(e.isTransientFailure());
    }

    @Test
    @DisplayName("I/O failures anywhere in the cause chain are network errors")
    void network() {
        var e = ProviderErrorClassifier.classify(
                new RuntimeException("I/O error on POST request", new ConnectException("Connection refused")));

        assertEquals(ProviderErrorKind.NETWORK, e.kind());
        assertTrue(e.isTransientFailure());
    }

    @Test
    @DisplayName("a connection failure to a port containing 401 is still a network error")
    void networkErrorMentioningStatusDigits() {
        var e = ProviderErrorClassifier.classify(new RuntimeException("I/O error",
                new IOException("Connect to http://llm-proxy:4010 failed: Connection refused")));

        assertEquals(ProviderErrorKind.NETWORK, e.kind());
        assertTrue(e.isTransientFailure());
    }

    @Test
    @DisplayName("status digits inside a request id are not read as a credential failure")
    void requestIdIsNotAStatus() {
        var e = ProviderErrorClassifier.classify(
                new NonTransientAiException("400 Bad Request (request id req_84010ab)"));

        assertEquals(ProviderErrorKind.UNKNOWN, e.kind());
    }

    @Test
    @DisplayName("a transient error is never treated as a credential failure")
    void transientMentioningAuthentication() {
        var e = ProviderErrorClassifier.classify(
                new TransientAiException("503 authentication service temporarily unavailable"));

        assertEquals(ProviderErrorKind.UNKNOWN, e.kind());
        assertTrue(e.isTransientFailure());
    }

    @Test
    @DisplayName("timeouts in the cause chain are retried")
    void timeout() {
        var e = ProviderErrorClassifier.classify(new RuntimeException("read", new TimeoutException("slow")));

        assertEquals(ProviderErrorKind.TIMEOUT, e.kind());
        assertTrue(e.isTransientFailure());
    }

    @Test
    @DisplayName("Spring AI's transient and non-transient markers decide the rest")
    void springAiMarkers() {
        assertTrue(ProviderErrorClassifier.classify(new TransientAiException("502 Bad Gateway")).isTransientFailure());
        assertFalse(ProviderErrorClassifier.classify(new NonTransientAiException("400 Bad Request")).isTransientFailure());
        assertEquals(ProviderErrorKind.UNKNOWN,
                ProviderErrorClassifier.classify(new IllegalStateException("boom")).kind());
    }

    @Test
    @DisplayName("an already classified exception is returned unchanged")
    void alreadyClassified() {
        var original = new LlmProviderException(ProviderErrorKind.QUOTA, false, "quota", null);

        assertSame(original, ProviderErrorClassifier.classify(original));
    }
}
