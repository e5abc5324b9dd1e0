package com.docsum.api.exception;

public class SummaryTimeoutException extends RuntimeException {
    
    public SummaryTimeoutException(long timeoutSeconds) {
        super("Summary was not produced within " + timeoutSeconds + " seconds");
    }
}
