package com.sahulatPay.statusProxy.lookup.exception;

/**
 * Exception thrown when the SahulatPay API does not answer within the configured timeout.
 */
public class UpstreamTimeoutException extends RuntimeException {
    
    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
