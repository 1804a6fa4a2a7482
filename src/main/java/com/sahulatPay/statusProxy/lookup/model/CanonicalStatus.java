package com.sahulatPay.statusProxy.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Locale;

/**
 * Normalized transaction status.
 * 
 * Four fixed kinds, plus OTHER which keeps the vendor's status upper-cased so
 * unrecognized states stay visible to callers.
 */
@EqualsAndHashCode
public final class CanonicalStatus {
    
    public enum Kind {
        COMPLETED,
        FAILED,
        PENDING,
        UNKNOWN,
        OTHER
    }
    
    public static final CanonicalStatus COMPLETED = new CanonicalStatus(Kind.COMPLETED, "COMPLETED");
    public static final CanonicalStatus FAILED = new CanonicalStatus(Kind.FAILED, "FAILED");
    public static final CanonicalStatus PENDING = new CanonicalStatus(Kind.PENDING, "PENDING");
    public static final CanonicalStatus UNKNOWN = new CanonicalStatus(Kind.UNKNOWN, "UNKNOWN");
    
    private final Kind kind;
    private final String value;
    
    private CanonicalStatus(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }
    
    /**
     * Wraps an unrecognized vendor status, upper-cased as received.
     */
    public static CanonicalStatus other(String rawStatus) {
        return new CanonicalStatus(Kind.OTHER, rawStatus.toUpperCase(Locale.ROOT));
    }
    
    public Kind getKind() {
        return kind;
    }
    
    @JsonValue
    public String value() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
