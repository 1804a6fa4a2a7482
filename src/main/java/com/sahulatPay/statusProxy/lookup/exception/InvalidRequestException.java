package com.sahulatPay.statusProxy.lookup.exception;

/**
 * Exception thrown when caller input is rejected before any upstream call.
 */
public class InvalidRequestException extends RuntimeException {
    
    public InvalidRequestException(String message) {
        super(message);
    }
}
