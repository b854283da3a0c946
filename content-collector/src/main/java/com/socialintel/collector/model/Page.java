package com.socialintel.collector.model;

import java.util.List;

/**
 * One page of a paginated API listing.
 *
 * @param items      items of this page
 * @param nextOffset offset of the next page, or {@code null} at end of data
 * @param totalCount total number of items the API reports for the listing
 */
public record Page<T>(List<T> items, Integer nextOffset, long totalCount) {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNext() {
        return nextOffset != null;
    }
}
