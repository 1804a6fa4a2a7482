package com.sahulatPay.statusProxy.lookup.service;

import com.sahulatPay.statusProxy.lookup.exception.InvalidRequestException;
import com.sahulatPay.statusProxy.lookup.model.BulkLookupEntry;
import com.sahulatPay.statusProxy.lookup.model.BulkLookupResult;
import com.sahulatPay.statusProxy.lookup.model.CanonicalStatus;
import com.sahulatPay.statusProxy.lookup.model.FailureKind;
import com.sahulatPay.statusProxy.lookup.model.LookupOutcome;
import com.sahulatPay.statusProxy.lookup.model.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a list of merchant transaction ids one after another.
 * 
 * Each id gets exactly one entry, in submission order. A timeout or error on
 * one id is recorded on that entry and the batch moves on.
 */
@Slf4j
@Service
public class BulkLookupService {
    
    static final String NOTE_UPSTREAM_NOT_OK = "Upstream not ok";
    static final String NOTE_UNKNOWN_STATUS = "Unknown status";
    
    private final LookupService lookupService;
    private final int maxIds;
    
    public BulkLookupService(
            LookupService lookupService,
            @Value("${status-proxy.bulk.max-ids:5000}") int maxIds) {
        this.lookupService = lookupService;
        this.maxIds = maxIds;
    }
    
    /**
     * Resolves every non-blank id in order.
     * 
     * @param ids Ids as submitted; blank entries are skipped
     * @param type Transaction type for the whole batch
     * @return Ordered entries with count and elapsed time
     * @throws InvalidRequestException if the list is empty or larger than the configured maximum
     */
    public BulkLookupResult resolveMany(List<String> ids, TransactionType type) {
        validate(ids);
        
        log.info("Bulk lookup started - type: {}, submitted ids: {}", type, ids.size());
        StopWatch stopWatch = new StopWatch("bulk-" + type);
        stopWatch.start();
        
        List<BulkLookupEntry> entries = new ArrayList<>(ids.size());
        for (String rawId : ids) {
            String orderId = rawId == null ? "" : rawId.trim();
            if (orderId.isEmpty()) {
                continue;
            }
            entries.add(resolveEntry(orderId, type));
        }
        
        stopWatch.stop();
        log.info("Bulk lookup finished - type: {}, entries: {}, elapsedMs: {}",
                type, entries.size(), stopWatch.getTotalTimeMillis());
        
        return BulkLookupResult.builder()
                .type(type)
                .entries(entries)
                .elapsedMs(stopWatch.getTotalTimeMillis())
                .build();
    }
    
    private void validate(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new InvalidRequestException("ids must be a non-empty list");
        }
        if (ids.size() > maxIds) {
            throw new InvalidRequestException("ids must contain at most " + maxIds + " entries");
        }
    }
    
    private BulkLookupEntry resolveEntry(String orderId, TransactionType type) {
        LookupOutcome outcome;
        try {
            outcome = lookupService.resolve(orderId, type);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in bulk lookup - orderId: {}, type: {}", orderId, type, e);
            outcome = LookupOutcome.error(orderId, type, String.valueOf(e.getMessage()));
        }
        return toEntry(outcome);
    }
    
    BulkLookupEntry toEntry(LookupOutcome outcome) {
        BulkLookupEntry.BulkLookupEntryBuilder entry = BulkLookupEntry.builder()
                .orderId(outcome.getOrderId())
                .type(outcome.getType())
                .statusCode(outcome.getStatusCode());
        
        if (outcome.isFailure()) {
            String kind = outcome.getFailureKind().name();
            String note = outcome.getFailureKind() == FailureKind.TIMEOUT ? kind : outcome.getErrorMessage();
            return entry
                    .status(kind)
                    .txnId(LookupService.NOT_AVAILABLE)
                    .processedAt(LookupService.NOT_AVAILABLE)
                    .note(note)
                    .build();
        }
        
        if (!outcome.isTransactionFound()) {
            return entry
                    .status(BulkLookupEntry.NOT_IN_BO)
                    .txnId(LookupService.NOT_AVAILABLE)
                    .processedAt(LookupService.NOT_AVAILABLE)
                    .note(BulkLookupEntry.NOT_IN_BO)
                    .build();
        }
        
        return entry
                .status(outcome.getStatus().value())
                .rawStatus(outcome.getRawStatus())
                .txnId(outcome.getTxnId())
                .processedAt(outcome.getDate())
                .note(noteFor(outcome))
                .build();
    }
    
    private String noteFor(LookupOutcome outcome) {
        if (!outcome.isUpstreamOk()) {
            return NOTE_UPSTREAM_NOT_OK;
        }
        if (outcome.getStatus().getKind() == CanonicalStatus.Kind.UNKNOWN) {
            return NOTE_UNKNOWN_STATUS;
        }
        if (outcome.getStatusCode() != 200) {
            return "HTTP " + outcome.getStatusCode();
        }
        return "";
    }
}
