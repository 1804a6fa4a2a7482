package com.sahulatPay.statusProxy.lookup.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sahulatPay.statusProxy.lookup.client.SahulatApiClient;
import com.sahulatPay.statusProxy.lookup.exception.UpstreamTimeoutException;
import com.sahulatPay.statusProxy.lookup.model.CanonicalStatus;
import com.sahulatPay.statusProxy.lookup.model.LookupOutcome;
import com.sahulatPay.statusProxy.lookup.model.TransactionType;
import com.sahulatPay.statusProxy.lookup.model.UpstreamResponse;
import com.sahulatPay.statusProxy.lookup.util.FieldPicker;
import com.sahulatPay.statusProxy.lookup.util.SecretSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves a single merchant transaction id into a {@link LookupOutcome}.
 * 
 * Handles:
 * - Calling the SahulatPay endpoint for the transaction type
 * - Picking the first transaction from the response
 * - Reading summary fields under their known aliases
 * - Normalizing the status
 * - Masking secrets in the echoed payload
 * 
 * Upstream failures never escape; they come back as TIMEOUT or ERROR outcomes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LookupService {
    
    static final List<String> TXN_ID_KEYS = List.of("transactionId", "txnId", "id");
    static final List<String> DATE_KEYS = List.of("createdAt", "created_at", "date_time", "date", "timestamp");
    static final List<String> AMOUNT_KEYS = List.of("amount", "totalAmount", "txnAmount", "balance");
    static final List<String> CURRENCY_KEYS = List.of("currency", "ccy");
    static final List<String> MERCHANT_KEYS = List.of("merchantName");
    
    static final String PROVIDER_MERCHANT_FIELD = "jazzCashMerchant";
    static final List<String> PROVIDER_MERCHANT_KEYS = List.of("merchant_of");
    
    static final JsonNode NOT_AVAILABLE = TextNode.valueOf("N/A");
    static final JsonNode DEFAULT_CURRENCY = TextNode.valueOf("PKR");
    
    private final SahulatApiClient sahulatApiClient;
    private final TransactionExtractor transactionExtractor;
    private final StatusNormalizer statusNormalizer;
    
    /**
     * Looks up one id against SahulatPay.
     * 
     * @param orderId Merchant transaction id, already trimmed and non-blank
     * @param type Transaction type
     * @return Success outcome, or a TIMEOUT / ERROR outcome
     */
    public LookupOutcome resolve(String orderId, TransactionType type) {
        try {
            UpstreamResponse response = sahulatApiClient.fetch(orderId, type);
            return buildOutcome(orderId, type, response);
        } catch (UpstreamTimeoutException e) {
            return LookupOutcome.timeout(orderId, type);
        } catch (Exception e) {
            log.error("Lookup failed - orderId: {}, type: {}, error: {}", orderId, type, e.getMessage(), e);
            return LookupOutcome.error(orderId, type, String.valueOf(e.getMessage()));
        }
    }
    
    private LookupOutcome buildOutcome(String orderId, TransactionType type, UpstreamResponse response) {
        JsonNode body = response.getBody();
        ObjectNode txn = transactionExtractor.extractFirst(body, type);
        
        String rawStatus = readStatus(txn);
        CanonicalStatus status = statusNormalizer.normalizeField(txn.get("status"));
        
        LookupOutcome outcome = LookupOutcome.builder()
                .orderId(orderId)
                .type(type)
                .upstreamOk(response.isOk())
                .statusCode(response.getStatusCode())
                .transactionFound(!txn.isEmpty())
                .status(status)
                .rawStatus(rawStatus)
                .txnId(FieldPicker.pick(txn, TXN_ID_KEYS, NOT_AVAILABLE))
                .date(FieldPicker.pick(txn, DATE_KEYS, NOT_AVAILABLE))
                .amount(FieldPicker.pick(txn, AMOUNT_KEYS, null))
                .currency(FieldPicker.pick(txn, CURRENCY_KEYS, DEFAULT_CURRENCY))
                .merchant(resolveMerchant(txn))
                .data(SecretSanitizer.sanitize(body))
                .build();
        
        log.debug("Lookup resolved - orderId: {}, type: {}, status: {}, found: {}",
                orderId, type, status, outcome.isTransactionFound());
        return outcome;
    }
    
    /**
     * Provider-specific merchant first, then the flat merchantName field.
     */
    private JsonNode resolveMerchant(ObjectNode txn) {
        JsonNode providerMerchant = FieldPicker.pick(txn.get(PROVIDER_MERCHANT_FIELD), PROVIDER_MERCHANT_KEYS, null);
        if (providerMerchant != null) {
            return providerMerchant;
        }
        return FieldPicker.pick(txn, MERCHANT_KEYS, null);
    }
    
    private String readStatus(ObjectNode txn) {
        JsonNode status = txn.get("status");
        if (status == null || status.isNull() || status.isContainerNode()) {
            return null;
        }
        return status.asText();
    }
}
