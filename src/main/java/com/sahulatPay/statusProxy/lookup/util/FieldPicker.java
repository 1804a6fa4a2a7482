package com.sahulatPay.statusProxy.lookup.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Utility class for reading a value that vendors publish under different field names.
 */
public class FieldPicker {
    
    private FieldPicker() {
    }
    
    /**
     * Returns the first candidate field holding a usable value.
     * Null, JSON null and empty strings count as absent.
     * 
     * @param record Transaction record; anything other than an object yields the default
     * @param candidateKeys Field names in priority order
     * @param defaultValue Value returned when no candidate is usable
     * @return The picked value or the default
     */
    public static JsonNode pick(JsonNode record, List<String> candidateKeys, JsonNode defaultValue) {
        if (record == null || !record.isObject()) {
            return defaultValue;
        }
        for (String key : candidateKeys) {
            JsonNode value = record.get(key);
            if (isPresent(value)) {
                return value;
            }
        }
        return defaultValue;
    }
    
    private static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        return !(value.isTextual() && value.textValue().isEmpty());
    }
}
