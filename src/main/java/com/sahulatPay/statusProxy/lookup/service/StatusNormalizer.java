package com.sahulatPay.statusProxy.lookup.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sahulatPay.statusProxy.lookup.model.CanonicalStatus;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

/**
 * Maps SahulatPay's free-form status text to a {@link CanonicalStatus}.
 * 
 * Matching is case- and whitespace-insensitive:
 * - success, completed -> COMPLETED
 * - failed, reversed -> FAILED
 * - pending, inprogress, processing -> PENDING
 * - blank, missing, false, 0 or a JSON object/array -> UNKNOWN
 * - anything else passes through upper-cased
 */
@Service
public class StatusNormalizer {
    
    private static final Set<String> COMPLETED = Set.of("success", "completed");
    private static final Set<String> FAILED = Set.of("failed", "reversed");
    private static final Set<String> PENDING = Set.of("pending", "inprogress", "processing");
    
    /**
     * Normalizes the status field as it appears in the upstream JSON.
     * Falsy values (null, false, 0, empty text) and containers count as absent.
     */
    public CanonicalStatus normalizeField(JsonNode status) {
        if (status == null || status.isNull() || status.isMissingNode() || status.isContainerNode()) {
            return CanonicalStatus.UNKNOWN;
        }
        if (status.isBoolean() && !status.booleanValue()) {
            return CanonicalStatus.UNKNOWN;
        }
        if (status.isNumber() && status.decimalValue().signum() == 0) {
            return CanonicalStatus.UNKNOWN;
        }
        return normalize(status.asText());
    }
    
    public CanonicalStatus normalize(String rawStatus) {
        if (rawStatus == null || rawStatus.isBlank()) {
            return CanonicalStatus.UNKNOWN;
        }
        String s = rawStatus.trim().toLowerCase(Locale.ROOT);
        if (COMPLETED.contains(s)) {
            return CanonicalStatus.COMPLETED;
        }
        if (FAILED.contains(s)) {
            return CanonicalStatus.FAILED;
        }
        if (PENDING.contains(s)) {
            return CanonicalStatus.PENDING;
        }
        return CanonicalStatus.other(rawStatus);
    }
}
