package com.sahulatPay.statusProxy.gateway.controller;

import com.sahulatPay.statusProxy.gateway.dto.BulkStatusResponse;
import com.sahulatPay.statusProxy.gateway.dto.StatusLookupResponse;
import com.sahulatPay.statusProxy.gateway.service.GatewayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status REST controller - thin HTTP layer in front of the lookup services.
 * 
 * Routes:
 * - GET / : health check
 * - GET /status?id=...&type=payout|payin : single lookup
 * - POST /bulk-status : bulk lookup
 */
@RestController
@CrossOrigin(origins = "${status-proxy.cors.allowed-origins:*}")
@RequiredArgsConstructor
public class StatusController {
    
    static final String SERVICE_NAME = "sahulatpay-status-proxy";
    
    private final GatewayService gatewayService;
    
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("service", SERVICE_NAME);
        return ResponseEntity.ok(response);
    }
    
    /**
     * Single lookup. The HTTP status mirrors the upstream's.
     * 
     * @param id Merchant transaction id
     * @param orderId Alias for id, used when id is absent or blank
     * @param type payout (default) or payin
     * @return Lookup response with summary and sanitized data
     */
    @GetMapping("/status")
    public ResponseEntity<StatusLookupResponse> status(
            @RequestParam(value = "id", required = false) String id,
            @RequestParam(value = "order_id", required = false) String orderId,
            @RequestParam(value = "type", required = false) String type) {
        
        StatusLookupResponse response = gatewayService.lookupStatus(id != null && !id.isBlank() ? id : orderId, type);
        return ResponseEntity.status(response.getHttpStatus()).body(response);
    }
    
    /**
     * Bulk lookup, one result per non-blank id in submission order.
     * The body is read as JSON whatever Content-Type the client sends.
     * 
     * @param body JSON object with type and ids
     * @return Bulk response
     */
    @PostMapping(value = "/bulk-status", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<BulkStatusResponse> bulkStatus(@RequestBody(required = false) String body) {
        return ResponseEntity.ok(gatewayService.bulkStatus(body));
    }
}
