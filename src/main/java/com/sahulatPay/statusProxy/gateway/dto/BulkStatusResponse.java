package com.sahulatPay.statusProxy.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sahulatPay.statusProxy.lookup.model.BulkLookupEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for bulk status lookup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkStatusResponse {
    
    private boolean ok;
    private String type;
    private int count;
    
    @JsonProperty("elapsed_ms")
    private long elapsedMs;
    
    private List<BulkLookupEntry> results;
}
