package com.resumeparse.llm.orchestrator;

import com.resumeparse.llm.provider.CompletionClient.CompletionException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failed completion call onto a {@link FailureKind}.
 */
public class FailureClassifier {
    
    private static final int MAX_CAUSE_DEPTH = 10;
    
    private final List<String> rateLimitPatterns;
    
    public FailureClassifier(List<String> rateLimitPatterns) {
        this.rateLimitPatterns = rateLimitPatterns.stream()
            .filter(p -> p != null && !p.isBlank())
            .map(p -> p.toLowerCase(Locale.ROOT))
            .toList();
    }
    
    public FailureKind classify(Throwable error) {
        if (error == null) {
            return FailureKind.UNKNOWN;
        }
        if (error instanceof CompletionException) {
            CompletionException completionError = (CompletionException) error;
            if (completionError.isRateLimited()
                || mentionsRateLimit(completionError.getMessage())
                || mentionsRateLimit(completionError.getResponseBody())) {
                return FailureKind.RATE_LIMITED;
            }
            if (completionError.isMalformed()) {
                return FailureKind.MALFORMED;
            }
            int status = completionError.getStatusCode();
            if (status == 408 || status == 504) {
                return FailureKind.TIMEOUT;
            }
        }
        
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isTimeout(current)) {
                return FailureKind.TIMEOUT;
            }
            if (mentionsRateLimit(current.getMessage())) {
                return FailureKind.RATE_LIMITED;
            }
            current = current.getCause();
        }
        
        current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof WebClientRequestException || current instanceof IOException) {
                return FailureKind.NETWORK;
            }
            current = current.getCause();
        }
        return FailureKind.UNKNOWN;
    }
    
    public boolean mentionsRateLimit(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String pattern : rateLimitPatterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
    
    private boolean isTimeout(Throwable error) {
        // reactor-netty read/write timeouts are netty TimeoutException subclasses
        return error instanceof TimeoutException
            || error instanceof SocketTimeoutException
            || error instanceof java.net.http.HttpTimeoutException
            || error.getClass().getSimpleName().endsWith("TimeoutException");
    }
}
