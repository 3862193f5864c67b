package com.acme.inventory.model;

import java.util.List;
import java.util.Optional;

/** Outcome of one account task. Exactly one exists per distinct submitted account id. */
public record AccountResult(
        String accountId,
        AccountStatus status,
        List<ResourceRecord> items,
        FailureDetail error,
        ResourceStatistics statistics) {

    public AccountResult {
        items = items == null ? List.of() : List.copyOf(items);
        statistics = statistics == null ? ResourceStatistics.EMPTY : statistics;
    }

    public static AccountResult success(String accountId, List<ResourceRecord> items, int failedItems) {
        return new AccountResult(
                accountId, AccountStatus.SUCCESS, items, null, ResourceStatistics.of(items, failedItems));
    }

    public static AccountResult failed(String accountId, FailureDetail error) {
        return new AccountResult(accountId, AccountStatus.FAILED, List.of(), error, ResourceStatistics.EMPTY);
    }

    public static AccountResult circuitOpen(String accountId, FailureDetail error) {
        return new AccountResult(
                accountId, AccountStatus.CIRCUIT_OPEN, List.of(), error, ResourceStatistics.EMPTY);
    }

    public Optional<FailureDetail> failure() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return status == AccountStatus.SUCCESS;
    }
}
