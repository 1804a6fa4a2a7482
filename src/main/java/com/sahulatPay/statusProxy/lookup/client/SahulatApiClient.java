package com.sahulatPay.statusProxy.lookup.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sahulatPay.statusProxy.lookup.exception.UpstreamCallException;
import com.sahulatPay.statusProxy.lookup.exception.UpstreamTimeoutException;
import com.sahulatPay.statusProxy.lookup.model.TransactionType;
import com.sahulatPay.statusProxy.lookup.model.UpstreamResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Client for the SahulatPay transaction lookup endpoints.
 * 
 * Issues one GET per lookup:
 * - payout: {sahulat.api.payout-url}?merchantTransactionId=...
 * - payin: {sahulat.api.payin-url}?merchantTransactionId=...
 * 
 * Error statuses are returned to the caller, not thrown. Only timeouts and
 * transport failures raise exceptions.
 */
@Slf4j
@Service
public class SahulatApiClient {
    
    static final String ORDER_ID_PARAM = "merchantTransactionId";
    
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final Map<TransactionType, String> endpoints = new EnumMap<>(TransactionType.class);
    
    public SahulatApiClient(
            RestClient sahulatRestClient,
            ObjectMapper objectMapper,
            @Value("${sahulat.api.payout-url:https://server.sahulatpay.com/disbursement/tele}") String payoutUrl,
            @Value("${sahulat.api.payin-url:https://server.sahulatpay.com/transactions/tele}") String payinUrl) {
        this.restClient = sahulatRestClient;
        this.objectMapper = objectMapper;
        this.endpoints.put(TransactionType.PAYOUT, payoutUrl);
        this.endpoints.put(TransactionType.PAYIN, payinUrl);
    }
    
    /**
     * Looks up a merchant transaction id.
     * 
     * @param orderId Merchant transaction id
     * @param type Selects the endpoint
     * @return Upstream status code and JSON-shaped body
     * @throws UpstreamTimeoutException if the call exceeds the configured timeout
     * @throws UpstreamCallException for any other transport failure
     */
    public UpstreamResponse fetch(String orderId, TransactionType type) {
        String baseUrl = endpoints.get(type);
        log.debug("Calling SahulatPay {} lookup - orderId: {}", type, orderId);
        
        try {
            UpstreamResponse response = restClient.get()
                    .uri(baseUrl, uriBuilder -> uriBuilder
                            .queryParam(ORDER_ID_PARAM, orderId)
                            .build())
                    .exchange((request, clientResponse) -> {
                        byte[] bytes = StreamUtils.copyToByteArray(clientResponse.getBody());
                        String text = new String(bytes, StandardCharsets.UTF_8);
                        return new UpstreamResponse(clientResponse.getStatusCode().value(), parseBody(text));
                    });
            
            log.info("SahulatPay {} lookup completed - orderId: {}, status: {}",
                    type, orderId, response.getStatusCode());
            return response;
            
        } catch (RestClientException e) {
            if (isTimeout(e)) {
                log.warn("SahulatPay {} lookup timed out - orderId: {}", type, orderId);
                throw new UpstreamTimeoutException("SahulatPay " + type + " lookup timed out", e);
            }
            log.error("SahulatPay {} lookup failed - orderId: {}, error: {}", type, orderId, e.getMessage());
            throw new UpstreamCallException(e.getMessage(), e);
        }
    }
    
    /**
     * Parses the body as JSON. Anything that is not valid JSON is wrapped as {"raw": text}.
     */
    JsonNode parseBody(String text) {
        try {
            JsonNode parsed = objectMapper.readTree(text);
            if (parsed != null && !parsed.isMissingNode()) {
                return parsed;
            }
        } catch (JsonProcessingException e) {
            log.debug("Upstream body is not JSON: {}", e.getOriginalMessage());
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.put("raw", text);
        return wrapper;
    }
    
    private boolean isTimeout(RestClientException e) {
        if (!(e instanceof ResourceAccessException)) {
            return false;
        }
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
            if (!(cause instanceof IOException)) {
                return false;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
