package com.bricks.sorter.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Cached catalog metadata of one design id.
 *
 * @param designId unique key
 * @param labels   category breadcrumbs, root-most first; never empty
 * @param image    PNG bytes, {@code null} while the image is unavailable
 * @param updated  day of the last fetch attempt
 */
public record CacheEntry(int designId, List<String> labels, byte[] image, LocalDate updated) {

    public CacheEntry {
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(updated, "updated");
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("labels must not be empty for part " + designId);
        }
        labels = List.copyOf(labels);
    }

    public boolean hasImage() {
        return image != null;
    }
}
