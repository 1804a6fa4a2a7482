package com.sahulatPay.statusProxy.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonPointer;
import com.sahulatPay.statusProxy.lookup.exception.InvalidRequestException;

import java.util.Locale;

/**
 * Transaction category supported by the SahulatPay lookup endpoints.
 * 
 * Each type knows where its response keeps the transactions array:
 * - payout: data.transactions
 * - payin: transactions
 */
public enum TransactionType {
    
    PAYOUT("payout", "/data/transactions"),
    PAYIN("payin", "/transactions");
    
    private final String wireName;
    private final JsonPointer transactionsPath;
    
    TransactionType(String wireName, String transactionsPath) {
        this.wireName = wireName;
        this.transactionsPath = JsonPointer.compile(transactionsPath);
    }
    
    @JsonValue
    public String getWireName() {
        return wireName;
    }
    
    public JsonPointer getTransactionsPath() {
        return transactionsPath;
    }
    
    /**
     * Parses the {@code type} request parameter. Blank means payout.
     * 
     * @param value Raw parameter value, may be null
     * @return Matching transaction type
     * @throws InvalidRequestException if the value is neither payout nor payin
     */
    public static TransactionType fromParam(String value) {
        if (value == null || value.isBlank()) {
            return PAYOUT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidRequestException("type must be payout or payin");
    }
    
    @Override
    public String toString() {
        return wireName;
    }
}
