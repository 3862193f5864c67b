package com.acme.inventory.model;

import java.util.Map;

public record ResourceDetail(String name, Map<String, String> attributes, Map<String, String> tags) {
    public ResourceDetail {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }
}
