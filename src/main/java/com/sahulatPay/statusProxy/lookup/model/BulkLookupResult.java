package com.sahulatPay.statusProxy.lookup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkLookupResult {
    
    private TransactionType type;
    private List<BulkLookupEntry> entries;
    private long elapsedMs;
    
    public int getCount() {
        return entries == null ? 0 : entries.size();
    }
}
