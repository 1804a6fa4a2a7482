package com.sahulatPay.statusProxy.gateway.dto;

/**
 * Error body shared by validation and unexpected failures.
 */
public record ErrorResponse(boolean ok, String code, String error) {
    
    public static ErrorResponse of(String code, String error) {
        return new ErrorResponse(false, code, error);
    }
}
