package com.sahulatPay.statusProxy.lookup.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Result of resolving one merchant transaction id.
 * 
 * Either a success (failureKind == null) carrying the summary fields and the
 * sanitized upstream payload, or a failure tagged TIMEOUT / ERROR.
 */
@Value
@Builder
public class LookupOutcome {
    
    String orderId;
    TransactionType type;
    
    /**
     * Set only when the upstream call did not complete.
     */
    FailureKind failureKind;
    String errorMessage;
    
    boolean upstreamOk;
    int statusCode;
    
    /**
     * False when the upstream answered but holds no transaction for the id.
     */
    boolean transactionFound;
    
    CanonicalStatus status;
    String rawStatus;
    JsonNode txnId;
    JsonNode date;
    JsonNode amount;
    JsonNode currency;
    JsonNode merchant;
    
    /**
     * Full upstream body with secrets masked.
     */
    JsonNode data;
    
    public boolean isFailure() {
        return failureKind != null;
    }
    
    public static LookupOutcome timeout(String orderId, TransactionType type) {
        return LookupOutcome.builder()
                .orderId(orderId)
                .type(type)
                .failureKind(FailureKind.TIMEOUT)
                .errorMessage("timeout")
                .statusCode(504)
                .build();
    }
    
    public static LookupOutcome error(String orderId, TransactionType type, String message) {
        return LookupOutcome.builder()
                .orderId(orderId)
                .type(type)
                .failureKind(FailureKind.ERROR)
                .errorMessage(message)
                .statusCode(500)
                .build();
    }
}
