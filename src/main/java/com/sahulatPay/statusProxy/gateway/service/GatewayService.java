package com.sahulatPay.statusProxy.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sahulatPay.statusProxy.gateway.dto.BulkStatusRequest;
import com.sahulatPay.statusProxy.gateway.dto.BulkStatusResponse;
import com.sahulatPay.statusProxy.gateway.dto.StatusLookupResponse;
import com.sahulatPay.statusProxy.gateway.dto.StatusSummary;
import com.sahulatPay.statusProxy.lookup.exception.InvalidRequestException;
import com.sahulatPay.statusProxy.lookup.model.BulkLookupResult;
import com.sahulatPay.statusProxy.lookup.model.FailureKind;
import com.sahulatPay.statusProxy.lookup.model.LookupOutcome;
import com.sahulatPay.statusProxy.lookup.model.TransactionType;
import com.sahulatPay.statusProxy.lookup.service.BulkLookupService;
import com.sahulatPay.statusProxy.lookup.service.LookupService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gateway service - validates request input and shapes lookup results for the UI.
 * 
 * Responsibilities:
 * - Validate id and type before any upstream call
 * - Read the bulk body as JSON whatever its Content-Type
 * - Accept bulk ids as a JSON array or a separated string
 * - Map lookup outcomes to response DTOs and HTTP statuses
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {
    
    private static final Pattern ID_SEPARATOR = Pattern.compile("[,\\r\\n]+");
    private static final String IDS_REQUIRED = "ids must be a non-empty list";
    
    private final LookupService lookupService;
    private final BulkLookupService bulkLookupService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    
    /**
     * Looks up one merchant transaction id.
     * 
     * @param id Merchant transaction id from the query string
     * @param typeParam payout or payin, blank means payout
     * @return Lookup response; {@link StatusLookupResponse#getHttpStatus()} holds the status to answer with
     * @throws InvalidRequestException if the id is blank or the type is invalid
     */
    public StatusLookupResponse lookupStatus(String id, String typeParam) {
        String orderId = id == null ? "" : id.trim();
        if (orderId.isEmpty()) {
            throw new InvalidRequestException("id is required");
        }
        TransactionType type = TransactionType.fromParam(typeParam);
        
        log.info("Status lookup - orderId: {}, type: {}", orderId, type);
        LookupOutcome outcome = lookupService.resolve(orderId, type);
        
        if (outcome.isFailure()) {
            return failureResponse(outcome);
        }
        
        StatusSummary summary = StatusSummary.builder()
                .status(outcome.getStatus().value())
                .txnId(outcome.getTxnId())
                .date(outcome.getDate())
                .amount(outcome.getAmount())
                .currency(outcome.getCurrency())
                .merchant(outcome.getMerchant())
                .build();
        
        return StatusLookupResponse.builder()
                .ok(outcome.isUpstreamOk())
                .statusCode(outcome.getStatusCode())
                .orderId(orderId)
                .type(type.getWireName())
                .summary(summary)
                .data(outcome.getData())
                .httpStatus(outcome.getStatusCode())
                .build();
    }
    
    /**
     * Looks up a batch of merchant transaction ids.
     * 
     * @param body Raw request body, expected to be a JSON object with type and ids
     * @return Ordered results with count and elapsed time
     * @throws InvalidRequestException if the body is unreadable, the type is invalid or the ids are empty or too many
     */
    public BulkStatusResponse bulkStatus(String body) {
        BulkStatusRequest request = readBulkRequest(body);
        TransactionType type = TransactionType.fromParam(request.getType());
        validate(request);
        List<String> ids = parseIds(request.getIds());
        
        BulkLookupResult result = bulkLookupService.resolveMany(ids, type);
        
        return BulkStatusResponse.builder()
                .ok(true)
                .type(type.getWireName())
                .count(result.getCount())
                .elapsedMs(result.getElapsedMs())
                .results(result.getEntries())
                .build();
    }
    
    /**
     * Parses the bulk body. A missing body reads as an empty request.
     */
    BulkStatusRequest readBulkRequest(String body) {
        if (body == null || body.isBlank()) {
            return new BulkStatusRequest();
        }
        try {
            BulkStatusRequest request = objectMapper.readValue(body, BulkStatusRequest.class);
            return request != null ? request : new BulkStatusRequest();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable bulk request body: {}", e.getOriginalMessage());
            throw new InvalidRequestException("request body must be a JSON object with type and ids");
        }
    }
    
    private void validate(BulkStatusRequest request) {
        Set<ConstraintViolation<BulkStatusRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations.iterator().next().getMessage());
        }
    }
    
    /**
     * Reads ids from a JSON array (strings or numbers) or a comma/newline separated string.
     * A string with no non-blank token is rejected like an empty list.
     */
    List<String> parseIds(JsonNode ids) {
        if (ids == null || ids.isNull()) {
            throw new InvalidRequestException(IDS_REQUIRED);
        }
        if (ids.isTextual()) {
            List<String> tokens = Arrays.asList(ID_SEPARATOR.split(ids.textValue()));
            if (tokens.stream().allMatch(String::isBlank)) {
                throw new InvalidRequestException(IDS_REQUIRED);
            }
            return tokens;
        }
        if (!ids.isArray()) {
            throw new InvalidRequestException(IDS_REQUIRED);
        }
        List<String> parsed = new ArrayList<>(ids.size());
        for (JsonNode id : ids) {
            parsed.add(id.isValueNode() && !id.isNull() ? id.asText() : "");
        }
        return parsed;
    }
    
    private StatusLookupResponse failureResponse(LookupOutcome outcome) {
        boolean timeout = outcome.getFailureKind() == FailureKind.TIMEOUT;
        HttpStatus status = timeout ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.INTERNAL_SERVER_ERROR;
        
        log.warn("Status lookup failed - orderId: {}, type: {}, kind: {}",
                outcome.getOrderId(), outcome.getType(), outcome.getFailureKind());
        
        return StatusLookupResponse.builder()
                .ok(false)
                .orderId(outcome.getOrderId())
                .type(outcome.getType().getWireName())
                .code(timeout ? "TIMEOUT" : "UPSTREAM_ERROR")
                .error(outcome.getErrorMessage())
                .httpStatus(status.value())
                .build();
    }
}
