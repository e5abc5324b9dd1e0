package com.docsum.llm.exception;

/**
 * The configured provider cannot be used: unknown provider name, missing credentials or model.
 * Raised while the application context is built, so no summarization run can start.
 */
public class LlmConfigurationException extends RuntimeException {

    public LlmConfigurationException(String message) {
        super(message);
    }
}
