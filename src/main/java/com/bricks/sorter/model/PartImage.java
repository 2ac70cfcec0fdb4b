package com.bricks.sorter.model;

/**
 * Cached image of a part; {@code image} is {@code null} when unavailable.
 */
public record PartImage(int designId, byte[] image) {
}
