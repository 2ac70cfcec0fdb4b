package com.bricks.sorter.model;

/**
 * One canonical inventory line: a colour-independent design id and the total
 * quantity owned.
 *
 * @param designId positive design id
 * @param quantity non-negative piece count
 */
public record PartRecord(int designId, long quantity) {

    public PartRecord {
        if (designId <= 0) {
            throw new IllegalArgumentException("designId must be positive: " + designId);
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must not be negative: " + quantity);
        }
    }
}
