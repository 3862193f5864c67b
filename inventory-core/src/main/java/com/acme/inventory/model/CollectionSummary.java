package com.acme.inventory.model;

import java.time.Duration;
import java.util.Collection;

public record CollectionSummary(
        int totalAccounts,
        int successfulAccounts,
        int failedAccounts,
        int circuitOpenAccounts,
        int totalResources,
        int taggedResources,
        int untaggedResources,
        int failedResources,
        Duration elapsed) {

    public static CollectionSummary of(Collection<AccountResult> results, Duration elapsed) {
        int successful = 0;
        int failed = 0;
        int circuitOpen = 0;
        int total = 0;
        int tagged = 0;
        int untagged = 0;
        int failedResources = 0;
        for (AccountResult r : results) {
            switch (r.status()) {
                case SUCCESS -> successful++;
                case FAILED -> failed++;
                case CIRCUIT_OPEN -> circuitOpen++;
            }
            total += r.statistics().total();
            tagged += r.statistics().tagged();
            untagged += r.statistics().untagged();
            failedResources += r.statistics().failed();
        }
        return new CollectionSummary(
                results.size(), successful, failed, circuitOpen, total, tagged, untagged, failedResources, elapsed);
    }

    public double taggingPercentage() {
        return totalResources == 0 ? 0.0 : taggedResources * 100.0 / totalResources;
    }

    public boolean isCompleteSuccess() {
        return successfulAccounts == totalAccounts && failedResources == 0;
    }

    public boolean isTotalFailure() {
        return totalAccounts > 0 && successfulAccounts == 0;
    }
}
