package com.bricks.sorter.render;

import com.bricks.sorter.cache.PartCacheRepository;
import com.bricks.sorter.model.ClusterSummary;
import com.bricks.sorter.model.PartImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ClusterHtmlRenderer")
class ClusterHtmlRendererTest {

    private static final byte[] PNG_A = {1, 2, 3};

    private static final byte[] PNG_B = {4, 5, 6};

    private PartCacheRepository cache;

    private ClusterHtmlRenderer renderer;

    @BeforeEach
    void setUp() {
        cache = mock(PartCacheRepository.class);
        when(cache.getImages(anyList())).thenReturn(List.of());
        renderer = new ClusterHtmlRenderer(cache, 4);
    }

    @Test
    @DisplayName("renders label, quantity and images in ascending id order, skipping missing images")
    void singleBlock() {
        // given
        ClusterSummary bin = new ClusterSummary("1. Basic, Bricks", 12, List.of(3001, 3002, 3003));
        when(cache.getImages(List.of(3001, 3002, 3003))).thenReturn(List.of(
                new PartImage(3001, PNG_A),
                new PartImage(3002, null),
                new PartImage(3003, PNG_B)));

        // when
        String html = renderer.render(List.of(bin));

        // then
        assertThat(html).contains("Basic, Bricks (12)</p>");
        assertThat(html).doesNotContain("1. Basic");
        String a = Base64.getEncoder().encodeToString(PNG_A);
        String b = Base64.getEncoder().encodeToString(PNG_B);
        assertThat(html).containsSubsequence("data:image/png;base64," + a, "data:image/png;base64," + b);
        assertThat(html.split("<img ", -1)).hasSize(3);
    }

    @Test
    @DisplayName("keeps the input order of the bins")
    void keepsOrder() {
        List<ClusterSummary> bins = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            bins.add(new ClusterSummary("Bin " + i, i, List.of(i + 1)));
        }

        String html = renderer.render(bins);

        String[] expected = bins.stream().map(c -> c.label() + " (" + c.quantity() + ")").toArray(String[]::new);
        assertThat(html).containsSubsequence(expected);
    }

    @Test
    @DisplayName("escapes markup in labels")
    void escapes() {
        String html = renderer.render(List.of(new ClusterSummary("Tiles <Printed> & Co", 1, List.of(1))));

        assertThat(html).contains("Tiles &lt;Printed&gt; &amp; Co (1)");
    }

    @Test
    @DisplayName("strips only the leading category index")
    void displayLabel() {
        assertThat(ClusterHtmlRenderer.displayLabel("12. Technic, 3. Gears")).isEqualTo("Technic, 3. Gears");
        assertThat(ClusterHtmlRenderer.displayLabel("Other")).isEqualTo("Other");
        assertThat(ClusterHtmlRenderer.displayLabel("1.Basic")).isEqualTo("1.Basic");
    }

    @Test
    @DisplayName("renders nothing for no bins")
    void empty() {
        assertThat(renderer.render(List.of())).isEmpty();
    }
}
