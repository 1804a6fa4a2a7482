package com.sahulatPay.statusProxy.lookup.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Status code and parsed body of one SahulatPay lookup call.
 * The body is always JSON-shaped; non-JSON bodies arrive as {"raw": text}.
 */
@Value
public class UpstreamResponse {
    
    int statusCode;
    JsonNode body;
    
    /**
     * Mirrors the vendor's idea of success: any status below 400.
     */
    public boolean isOk() {
        return statusCode < 400;
    }
}
