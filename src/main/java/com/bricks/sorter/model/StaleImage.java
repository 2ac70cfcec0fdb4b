package com.bricks.sorter.model;

import java.time.LocalDate;

/**
 * A cached part that still has no image.
 *
 * @param designId   cache key
 * @param lastUpdated day of the last fetch attempt
 */
public record StaleImage(int designId, LocalDate lastUpdated) {
}
