package com.bricks.sorter.model;

import java.util.List;

/**
 * The result of one load: every distinct part of the inventory, ascending by
 * design id, with labels resolved.
 *
 * @param records enriched records, one per design id
 */
public record EnrichedWorkingSet(List<EnrichedRecord> records) {

    public EnrichedWorkingSet {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public List<Integer> designIds() {
        return records.stream().map(EnrichedRecord::designId).toList();
    }

    public long totalQuantity() {
        return records.stream().mapToLong(EnrichedRecord::quantity).sum();
    }
}
