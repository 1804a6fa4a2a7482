package com.sahulatPay.statusProxy.lookup.exception;

/**
 * Exception thrown when the SahulatPay API call fails for any reason other than a timeout.
 */
public class UpstreamCallException extends RuntimeException {
    
    public UpstreamCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
