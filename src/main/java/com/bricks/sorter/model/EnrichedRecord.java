package com.bricks.sorter.model;

import java.util.List;

/**
 * A canonical record joined with its category breadcrumbs.
 *
 * @param part   the inventory line
 * @param labels breadcrumbs, root-most first; {@code null} until fetched
 */
public record EnrichedRecord(PartRecord part, List<String> labels) {

    public EnrichedRecord {
        labels = labels == null ? null : List.copyOf(labels);
    }

    public int designId() {
        return part.designId();
    }

    public long quantity() {
        return part.quantity();
    }

    public boolean hasLabels() {
        return labels != null && !labels.isEmpty();
    }

    public EnrichedRecord withLabels(List<String> newLabels) {
        return new EnrichedRecord(part, newLabels);
    }
}
