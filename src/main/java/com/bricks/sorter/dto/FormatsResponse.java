package com.bricks.sorter.dto;

/**
 * Response body of {@code GET /api/clusters/formats}.
 *
 * @param extensions       accepted file extensions, comma separated
 * @param setLookupEnabled whether a set number can be used instead of a file
 */
public record FormatsResponse(String extensions, boolean setLookupEnabled) {
}
