package com.sahulatPay.statusProxy.lookup.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sahulatPay.statusProxy.lookup.model.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Locates the first transaction in a SahulatPay lookup response.
 * 
 * Payout and payin responses keep their transactions at different paths;
 * the path comes from {@link TransactionType#getTransactionsPath()}.
 */
@Slf4j
@Service
public class TransactionExtractor {
    
    /**
     * Returns the first transaction record, or an empty object when the
     * response holds none or is not shaped as expected. Never throws.
     * 
     * @param response Parsed upstream body
     * @param type Transaction type that selects the response shape
     * @return First transaction, or an empty record
     */
    public ObjectNode extractFirst(JsonNode response, TransactionType type) {
        if (response == null || !response.isObject()) {
            return emptyRecord();
        }
        
        JsonNode transactions = response.at(type.getTransactionsPath());
        if (!transactions.isArray() || transactions.isEmpty()) {
            log.debug("No transactions at {} for type {}", type.getTransactionsPath(), type);
            return emptyRecord();
        }
        
        JsonNode first = transactions.get(0);
        if (!first.isObject()) {
            log.warn("First transaction for type {} is not an object: {}", type, first.getNodeType());
            return emptyRecord();
        }
        return (ObjectNode) first;
    }
    
    private ObjectNode emptyRecord() {
        return JsonNodeFactory.instance.objectNode();
    }
}
