package com.acme.inventory.model;

import com.acme.inventory.resilience.CircuitSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one collection run produced. {@code results} iterates in input order, so the reported
 * outcome for a given input does not depend on completion order.
 */
public record CollectionResult(
        String executionId,
        String service,
        Map<String, AccountResult> results,
        CollectionSummary summary,
        Map<String, CircuitSnapshot> circuits) {

    public CollectionResult {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        circuits = Collections.unmodifiableMap(new LinkedHashMap<>(circuits));
    }

    public AccountResult result(String accountId) {
        return results.get(accountId);
    }

    /** Records of all successful accounts, account by account in input order. */
    public List<ResourceRecord> allRecords() {
        List<ResourceRecord> all = new ArrayList<>();
        for (AccountResult r : results.values()) {
            if (r.isSuccess()) {
                all.addAll(r.items());
            }
        }
        return all;
    }
}
