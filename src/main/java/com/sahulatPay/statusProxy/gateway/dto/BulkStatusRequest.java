package com.sahulatPay.statusProxy.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for bulk status lookup.
 * 
 * ids is either a JSON array of ids or a single comma/newline separated string.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkStatusRequest {
    
    private String type;
    
    @NotNull(message = "ids must be a non-empty list")
    private JsonNode ids;
}
