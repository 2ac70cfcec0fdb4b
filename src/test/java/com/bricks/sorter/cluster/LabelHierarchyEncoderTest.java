package com.bricks.sorter.cluster;

import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.model.EnrichedRecord;
import com.bricks.sorter.model.PartRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LabelHierarchyEncoder")
class LabelHierarchyEncoderTest {

    private final SorterProperties props = new SorterProperties();

    private final LabelHierarchyEncoder encoder = new LabelHierarchyEncoder(props);

    private static EnrichedRecord rec(int id, String... labels) {
        return new EnrichedRecord(new PartRecord(id, 1), labels.length == 0 ? null : List.of(labels));
    }

    @Test
    @DisplayName("excludes the root term and orders columns breadth first")
    void columns() {
        // given
        List<EnrichedRecord> records = List.of(
                rec(1, "Lego", "Technic", "Gears"),
                rec(2, "Lego", "Technic", "Pins"));

        // when
        FeatureMatrix m = encoder.encode(records);

        // then
        assertThat(m.columns()).containsExactly("Technic", "Gears", "Pins");
        assertThat(m.value(0, 0)).isTrue();
        assertThat(m.value(0, 1)).isTrue();
        assertThat(m.value(0, 2)).isFalse();
        assertThat(m.carriesRoot(0)).isTrue();
    }

    @Test
    @DisplayName("all first-level terms come before any second-level term")
    void breadthFirst() {
        FeatureMatrix m = encoder.encode(List.of(
                rec(1, "Lego", "1. Basic", "Bricks"),
                rec(2, "Lego", "2. Wall", "Panels"),
                rec(3, "Lego", "1. Basic", "Plates")));

        assertThat(m.columns()).containsExactly("1. Basic", "2. Wall", "Bricks", "Panels", "Plates");
    }

    @Test
    @DisplayName("membership reproduces every label set exactly")
    void roundTrip() {
        List<EnrichedRecord> records = List.of(
                rec(1, "Lego", "Bricks", "Bricks Round"),
                rec(2, "Lego", "Bricks"),
                rec(3, "Lego", "Technic", "Gears", "Worm"),
                rec(4, "Lego"));

        FeatureMatrix m = encoder.encode(records);

        for (int i = 0; i < records.size(); i++) {
            Set<String> decoded = new HashSet<>();
            if (m.carriesRoot(i)) {
                decoded.add(m.rootTerm());
            }
            for (int j = 0; j < m.columns().size(); j++) {
                if (m.value(i, j)) {
                    decoded.add(m.columns().get(j));
                }
            }
            assertThat(decoded).isEqualTo(new HashSet<>(records.get(i).labels()));
        }
    }

    @Test
    @DisplayName("a term is matched exactly, not as a substring")
    void exactMembership() {
        FeatureMatrix m = encoder.encode(List.of(
                rec(1, "Lego", "Bricks Round"),
                rec(2, "Lego", "Bricks")));

        int bricks = m.columns().indexOf("Bricks");
        assertThat(m.value(0, bricks)).isFalse();
        assertThat(m.value(1, bricks)).isTrue();
    }

    @Test
    @DisplayName("records without labels count as root only")
    void missingLabels() {
        FeatureMatrix m = encoder.encode(List.of(rec(1), rec(2, "Lego", "Bricks")));

        assertThat(m.carriesRoot(0)).isTrue();
        assertThat(m.points()[0]).containsOnly(0.0);
        assertThat(m.columns()).containsExactly("Bricks");
    }

    @Test
    @DisplayName("terms below the depth cap are ignored")
    void depthCap() {
        props.setMaxLabelDepth(2);

        FeatureMatrix m = encoder.encode(List.of(rec(1, "Lego", "Technic", "Gears", "Worm")));

        assertThat(m.columns()).containsExactly("Technic");
    }

    @Test
    @DisplayName("weights are the quantities")
    void weights() {
        FeatureMatrix m = encoder.encode(List.of(
                new EnrichedRecord(new PartRecord(1, 12), List.of("Lego")),
                new EnrichedRecord(new PartRecord(2, 0), List.of("Lego"))));

        assertThat(m.weights()).containsExactly(12.0, 0.0);
    }
}
