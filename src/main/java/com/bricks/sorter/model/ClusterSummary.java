package com.bricks.sorter.model;

import java.util.List;

/**
 * One sorting bin.
 *
 * @param label    comma-joined categories shared by all members, or "Other"
 * @param quantity total pieces in the bin
 * @param members  design ids, ascending
 */
public record ClusterSummary(String label, long quantity, List<Integer> members) {

    public ClusterSummary {
        members = List.copyOf(members);
    }
}
