package com.bricks.sorter.cluster;

import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.error.InvalidParameterException;
import com.bricks.sorter.model.ClusterSummary;
import com.bricks.sorter.model.ClusteringResult;
import com.bricks.sorter.model.EnrichedRecord;
import com.bricks.sorter.model.EnrichedWorkingSet;
import com.bricks.sorter.model.PartRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InventoryClusterer")
class InventoryClustererTest {

    private final SorterProperties props = new SorterProperties();

    private final InventoryClusterer clusterer = new InventoryClusterer(new LabelHierarchyEncoder(props), props);

    private static EnrichedRecord rec(int id, int qty, String... labels) {
        return new EnrichedRecord(new PartRecord(id, qty), List.of(labels));
    }

    private static EnrichedWorkingSet sample() {
        return new EnrichedWorkingSet(List.of(
                rec(3001, 40, "Lego", "1. Basic", "Bricks"),
                rec(3002, 20, "Lego", "1. Basic", "Bricks"),
                rec(3003, 30, "Lego", "1. Basic", "Bricks"),
                rec(3647, 5, "Lego", "Technic", "Gears"),
                rec(3648, 7, "Lego", "Technic", "Gears"),
                rec(99999, 2, "Lego")));
    }

    @Test
    @DisplayName("members partition the working set exactly once")
    void partition() {
        ClusteringResult result = clusterer.cluster(sample(), 3, "42");

        List<Integer> all = new ArrayList<>();
        result.clusters().forEach(c -> all.addAll(c.members()));
        assertThat(all).containsExactlyInAnyOrder(3001, 3002, 3003, 3647, 3648, 99999);
        assertThat(result.clusters()).allSatisfy(c -> assertThat(c.members()).isSorted());
    }

    @Test
    @DisplayName("names bins after shared categories and sorts them by quantity")
    void labelsAndOrder() {
        // when
        ClusteringResult result = clusterer.cluster(sample(), 3, "42");

        // then
        assertThat(result.clusters()).extracting(ClusterSummary::quantity).isSorted();
        assertThat(result.clusters()).extracting(ClusterSummary::label)
                .containsExactly("Other", "Technic, Gears", "1. Basic, Bricks");
        assertThat(result.clusters().get(2).quantity()).isEqualTo(90);
        assertThat(result.clusters().get(2).members()).containsExactly(3001, 3002, 3003);
    }

    @Test
    @DisplayName("k equal to the number of parts gives singleton bins with unchanged quantities")
    void singletons() {
        ClusteringResult result = clusterer.cluster(sample(), 6, "7");

        assertThat(result.clusters()).allSatisfy(c -> assertThat(c.members()).hasSize(1));
        assertThat(result.clusters()).extracting(ClusterSummary::quantity)
                .containsExactly(2L, 5L, 7L, 20L, 30L, 40L);
        assertThat(result.clusters().get(0).label()).isEqualTo("Other");
        assertThat(result.clusters().get(1).label()).isEqualTo("Technic, Gears");
    }

    @Test
    @DisplayName("a part without breadcrumbs lands in Other")
    void unresolvedPart() {
        EnrichedWorkingSet set = new EnrichedWorkingSet(List.of(
                rec(3001, 10, "Lego", "Bricks"),
                new EnrichedRecord(new PartRecord(99999, 1), List.of("Lego"))));

        ClusteringResult result = clusterer.cluster(set, 2, "1");

        assertThat(result.clusters().get(0).label()).isEqualTo("Other");
        assertThat(result.clusters().get(0).members()).containsExactly(99999);
    }

    @Test
    @DisplayName("one bin holding different branches shares only what all members carry")
    void singleBin() {
        ClusteringResult result = clusterer.cluster(sample(), 1, "5");

        assertThat(result.clusters()).singleElement()
                .satisfies(c -> {
                    assertThat(c.label()).isEqualTo("Other");
                    assertThat(c.quantity()).isEqualTo(104);
                });
    }

    @Test
    @DisplayName("a member whose breadcrumbs start elsewhere still counts towards the bin")
    void memberWithoutRootTerm() {
        // given
        EnrichedWorkingSet set = new EnrichedWorkingSet(List.of(
                rec(3001, 10, "Lego", "1. Basic", "Bricks"),
                rec(4265, 3, "Parts Index", "Technic")));

        // when
        ClusteringResult result = clusterer.cluster(set, 1, "3");

        // then
        assertThat(result.clusters()).singleElement()
                .satisfies(c -> {
                    assertThat(c.label()).isEqualTo("Other");
                    assertThat(c.members()).containsExactly(3001, 4265);
                });
    }

    @Test
    @DisplayName("members without the root term may still share categories")
    void sharedBranchWithoutRootTerm() {
        EnrichedWorkingSet set = new EnrichedWorkingSet(List.of(
                rec(4265, 3, "Parts Index", "Technic"),
                rec(4266, 4, "Parts Index", "Technic")));

        ClusteringResult result = clusterer.cluster(set, 1, "3");

        assertThat(result.clusters().get(0).label()).isEqualTo("Parts Index, Technic");
    }

    @Test
    @DisplayName("rejects k outside 1..number of parts")
    void invalidK() {
        assertThatThrownBy(() -> clusterer.cluster(sample(), 0, null))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> clusterer.cluster(sample(), 7, null))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("6");
    }

    @Test
    @DisplayName("reports the seed and reproduces runs from it")
    void seedReproducible() {
        ClusteringResult first = clusterer.cluster(sample(), 2, null);

        ClusteringResult again = clusterer.cluster(sample(), 2, Long.toString(first.usedSeed()));

        assertThat(first.usedSeed()).isBetween(0L, InventoryClusterer.SEED_BOUND - 1);
        assertThat(again.usedSeed()).isEqualTo(first.usedSeed());
        assertThat(again.clusters()).isEqualTo(first.clusters());
        assertThat(again.requestedClusters()).isEqualTo(2);
    }

    @Test
    @DisplayName("malformed or out-of-range seeds are replaced, not rejected")
    void parseSeed() {
        assertThat(InventoryClusterer.parseSeed(" 123 ")).hasValue(123L);
        assertThat(InventoryClusterer.parseSeed("4294967295")).hasValue(4294967295L);
        assertThat(InventoryClusterer.parseSeed("4294967296")).isEmpty();
        assertThat(InventoryClusterer.parseSeed("-1")).isEmpty();
        assertThat(InventoryClusterer.parseSeed("abc")).isEmpty();
        assertThat(InventoryClusterer.parseSeed("")).isEmpty();
        assertThat(InventoryClusterer.parseSeed(null)).isEmpty();

        ClusteringResult result = clusterer.cluster(sample(), 2, "not-a-seed");
        assertThat(result.usedSeed()).isBetween(0L, InventoryClusterer.SEED_BOUND - 1);
    }
}
