package com.acme.inventory.model;

import java.util.Map;

/** A collected resource: identity, attributes and tags. Immutable once produced. */
public record ResourceRecord(
        String accountId,
        String service,
        String resourceType,
        String resourceId,
        String name,
        Map<String, String> attributes,
        Map<String, String> tags) {

    public ResourceRecord {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static ResourceRecord from(String accountId, String service, ResourceItem item, ResourceDetail detail) {
        return new ResourceRecord(
                accountId,
                service,
                item.resourceType(),
                item.resourceId(),
                detail.name(),
                detail.attributes(),
                detail.tags());
    }

    public boolean isTagged() {
        return !tags.isEmpty();
    }
}
