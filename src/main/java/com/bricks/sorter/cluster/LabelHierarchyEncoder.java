package com.bricks.sorter.cluster;

import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.model.EnrichedRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns breadcrumb lists into a {@link FeatureMatrix}.
 *
 * <p>Columns are ordered breadth-first: every first-level category before any
 * second-level one, each term once, in order of first appearance. A row has a
 * 1 in a column iff the exact term occurs anywhere in its breadcrumbs.
 * Breadcrumbs deeper than {@code sorter.max-label-depth} are cut off.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LabelHierarchyEncoder {

    private final SorterProperties props;

    /**
     * @param records working-set records; missing breadcrumbs count as root-only
     * @return membership matrix with one row per record, in input order
     */
    public FeatureMatrix encode(final List<EnrichedRecord> records) {
        String root = props.getRootTerm();
        List<List<String>> trails = new ArrayList<>(records.size());
        int depth = 0;
        for (EnrichedRecord r : records) {
            List<String> trail = trail(r, root);
            trails.add(trail);
            depth = Math.max(depth, trail.size());
        }

        LinkedHashSet<String> columns = new LinkedHashSet<>();
        for (int d = 0; d < depth; d++) {
            for (List<String> trail : trails) {
                if (d < trail.size()) {
                    String term = trail.get(d);
                    if (!term.isEmpty() && !term.equals(root)) {
                        columns.add(term);
                    }
                }
            }
        }
        List<String> columnList = new ArrayList<>(columns);

        boolean[][] values = new boolean[records.size()][columnList.size()];
        boolean[] carriesRoot = new boolean[records.size()];
        for (int i = 0; i < trails.size(); i++) {
            Set<String> terms = new HashSet<>(trails.get(i));
            carriesRoot[i] = terms.contains(root);
            for (int j = 0; j < columnList.size(); j++) {
                values[i][j] = terms.contains(columnList.get(j));
            }
        }

        log.debug("Encoded {} records into {} category columns (depth {})",
                records.size(), columnList.size(), depth);
        return new FeatureMatrix(root, columnList, records, values, carriesRoot);
    }

    private List<String> trail(final EnrichedRecord record, final String root) {
        if (!record.hasLabels()) {
            return List.of(root);
        }
        List<String> labels = record.labels();
        if (labels.size() > props.getMaxLabelDepth()) {
            log.debug("Breadcrumbs of part {} cut at depth {}", record.designId(), props.getMaxLabelDepth());
            return labels.subList(0, props.getMaxLabelDepth());
        }
        return labels;
    }
}
