package com.sahulatPay.statusProxy.lookup.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Utility class for masking secret-bearing fields in upstream payloads before
 * they are echoed back to the caller.
 */
public class SecretSanitizer {
    
    public static final String MASK = "***";
    
    public static final Set<String> SECRET_KEYS = Set.of(
            "password",
            "integritySalt",
            "integrity_salt",
            "secret",
            "salt",
            "apiKey",
            "api_key"
    );
    
    private SecretSanitizer() {
    }
    
    /**
     * Returns a copy of the given tree with every value under a secret key
     * replaced by {@value #MASK}, at any depth. The input is left untouched.
     * 
     * @param node Any JSON value, may be null
     * @return Sanitized copy (scalars are returned as-is)
     */
    public static JsonNode sanitize(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(sanitize(element));
            }
            return copy;
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (SECRET_KEYS.contains(field.getKey())) {
                    copy.put(field.getKey(), MASK);
                } else {
                    copy.set(field.getKey(), sanitize(field.getValue()));
                }
            }
            return copy;
        }
        return node;
    }
}
