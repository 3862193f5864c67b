package com.acme.inventory.model;

import java.util.List;

/** One page of a listing; {@code nextCursor} is null on the last page. */
public record ResourcePage(List<ResourceItem> items, String nextCursor) {
    public ResourcePage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ResourcePage last(List<ResourceItem> items) {
        return new ResourcePage(items, null);
    }

    public boolean hasNext() {
        return nextCursor != null && !nextCursor.isEmpty();
    }
}
