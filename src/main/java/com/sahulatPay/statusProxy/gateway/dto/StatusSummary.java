package com.sahulatPay.statusProxy.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat view of the first transaction, for the UI status card.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatusSummary {
    
    /**
     * COMPLETED / FAILED / PENDING / UNKNOWN, or the vendor status upper-cased.
     */
    private String status;
    
    @JsonProperty("txn_id")
    private JsonNode txnId;
    
    private JsonNode date;
    private JsonNode amount;
    private JsonNode currency;
    private JsonNode merchant;
}
