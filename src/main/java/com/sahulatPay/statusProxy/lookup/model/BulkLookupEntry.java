package com.sahulatPay.statusProxy.lookup.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a bulk lookup, in the order the id was submitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkLookupEntry {
    
    public static final String NOT_IN_BO = "NOT_IN_BO";
    
    @JsonProperty("order_id")
    private String orderId;
    private TransactionType type;
    
    /**
     * Canonical status value, or NOT_IN_BO / TIMEOUT / ERROR.
     */
    private String status;
    @JsonProperty("raw_status")
    private String rawStatus;
    @JsonProperty("txn_id")
    private JsonNode txnId;
    @JsonProperty("processed_at")
    private JsonNode processedAt;
    @JsonProperty("status_code")
    private int statusCode;
    
    /**
     * Anomaly description, empty string when there is none.
     */
    private String note;
}
