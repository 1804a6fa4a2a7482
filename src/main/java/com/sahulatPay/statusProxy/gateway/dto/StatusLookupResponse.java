package com.sahulatPay.statusProxy.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a single status lookup.
 * 
 * On success carries the summary and the sanitized upstream payload.
 * On timeout or upstream failure carries code and error instead.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusLookupResponse {
    
    private boolean ok;
    
    @JsonProperty("status_code")
    private Integer statusCode;
    
    @JsonProperty("order_id")
    private String orderId;
    
    private String type;
    private StatusSummary summary;
    private JsonNode data;
    
    private String code;
    private String error;
    
    /**
     * Status the proxy answers with. Mirrors upstream on success.
     */
    @JsonIgnore
    private int httpStatus;
}
