package com.docsum.llm.exception;

import com.docsum.llm.provider.LlmProvider;

/**
 * A single text-generation call failed: network error, provider-side rejection,
 * malformed or blocked response, or the calling task was interrupted.
 */
public class GenerationException extends RuntimeException {

    /** Status code used when the failure did not come from an HTTP response. */
    public static final int NO_STATUS = -1;

    private final LlmProvider provider;
    private final int statusCode;
    private final boolean retryable;

    public GenerationException(String message, LlmProvider provider, int statusCode, boolean retryable) {
        super(message);
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public GenerationException(String message, LlmProvider provider, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public GenerationException(String message, Throwable cause) {
        this(message, null, NO_STATUS, false, cause);
    }

    public LlmProvider getProvider() { return provider; }
    public int getStatusCode() { return statusCode; }
    public boolean isRetryable() { return retryable; }
    public boolean isRateLimited() { return statusCode == 429; }
    public boolean isAuthError() { return statusCode == 401 || statusCode == 403; }
}
