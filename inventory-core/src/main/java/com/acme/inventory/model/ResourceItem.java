package com.acme.inventory.model;

import java.util.Map;

/**
 * An entry of a listing page. {@code attributes} carries whatever the listing already returned
 * (including tags for services that inline them) so the detail fetch can avoid a second call.
 */
public record ResourceItem(String resourceId, String resourceType, Map<String, String> attributes) {
    public ResourceItem {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static ResourceItem of(String resourceId, String resourceType) {
        return new ResourceItem(resourceId, resourceType, Map.of());
    }
}
