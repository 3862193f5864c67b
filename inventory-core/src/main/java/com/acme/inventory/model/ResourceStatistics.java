package com.acme.inventory.model;

import java.util.List;

/**
 * Per-account counts. {@code total} counts the records returned; {@code failed} counts items whose
 * detail fetch failed and were therefore left out.
 */
public record ResourceStatistics(int total, int tagged, int untagged, int failed) {
    public static final ResourceStatistics EMPTY = new ResourceStatistics(0, 0, 0, 0);

    public static ResourceStatistics of(List<ResourceRecord> records, int failed) {
        int tagged = (int) records.stream().filter(ResourceRecord::isTagged).count();
        return new ResourceStatistics(records.size(), tagged, records.size() - tagged, failed);
    }

    public double taggingPercentage() {
        return total == 0 ? 0.0 : tagged * 100.0 / total;
    }
}
