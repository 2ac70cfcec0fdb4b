package com.bricks.sorter.render;

import com.bricks.sorter.cache.PartCacheRepository;
import com.bricks.sorter.model.ClusterSummary;
import com.bricks.sorter.model.PartImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.bricks.sorter.service.catalog.CatalogHttpEngine.MILLISECONDS_VALUE;

/**
 * Renders bins as a self-contained HTML fragment, one {@code <div>} per bin
 * with its name, piece count and the cached images of its members.
 */
@Slf4j
@Component
public class ClusterHtmlRenderer {

    /** Category index BrickArchitect prefixes to top-level names ("1. Basic"). */
    private static final Pattern CATEGORY_INDEX = Pattern.compile("^\\d+\\. ");

    private final PartCacheRepository cache;

    private final int parallelism;

    @Autowired
    public ClusterHtmlRenderer(final PartCacheRepository cache) {
        this(cache, Runtime.getRuntime().availableProcessors());
    }

    ClusterHtmlRenderer(final PartCacheRepository cache, final int parallelism) {
        this.cache = cache;
        this.parallelism = parallelism;
    }

    /**
     * @param clusters bins in display order
     * @return concatenated blocks, in the order of {@code clusters}
     */
    public String render(final List<ClusterSummary> clusters) {
        long t0 = System.nanoTime();
        String html = Flux.fromIterable(clusters)
                .flatMapSequential(c -> Mono.fromCallable(() -> renderCluster(c))
                                .subscribeOn(Schedulers.boundedElastic()),
                        Math.max(1, parallelism))
                .collect(Collectors.joining())
                .block();
        log.info("RENDER  BINS={}  TOTAL={} ms", clusters.size(), (System.nanoTime() - t0) / MILLISECONDS_VALUE);
        return html == null ? "" : html;
    }

    String renderCluster(final ClusterSummary cluster) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("<div>\n");
        sb.append("<p style=\"margin: 10px; font-size: 32px;\">")
                .append(HtmlUtils.htmlEscape(displayLabel(cluster.label())))
                .append(" (").append(cluster.quantity()).append(")</p>\n");

        for (PartImage img : cache.getImages(cluster.members())) {
            if (img.image() != null) {
                sb.append("<img src=\"data:image/png;base64,")
                        .append(Base64.getEncoder().encodeToString(img.image()))
                        .append("\" alt=\"").append(img.designId())
                        .append("\" style=\"margin: 10px;\">\n");
            }
        }
        sb.append("</div>\n<br>");
        return sb.toString();
    }

    /**
     * Strips the leading category index, e.g. "1. Basic, Bricks" → "Basic, Bricks".
     */
    static String displayLabel(final String label) {
        return CATEGORY_INDEX.matcher(label).replaceFirst("");
    }
}
