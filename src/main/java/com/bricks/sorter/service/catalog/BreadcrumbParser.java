package com.bricks.sorter.service.catalog;

import com.bricks.sorter.config.SorterProperties;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the category breadcrumbs from a BrickArchitect part page.
 *
 * <pre>{@code
 * <div class="chapternav">
 *   <a href="/parts/">The LEGO Parts Guide</a> <a href="/parts/category-1">1. Basic</a> …
 * </div>
 * }</pre>
 *
 * The site-wide root crumb is replaced by the configured root term. Commas
 * inside a crumb become spaces, as the cache stores labels comma-joined.
 */
@Component
@RequiredArgsConstructor
public class BreadcrumbParser {

    private final SorterProperties props;

    /**
     * @param html part page
     * @return breadcrumbs, root-most first; empty when the page has none
     */
    public List<String> parse(final String html) {
        Document doc = Jsoup.parse(html);
        Element nav = doc.selectFirst("div.chapternav");
        if (nav == null) {
            return List.of();
        }

        List<String> crumbs = new ArrayList<>();
        for (Element a : nav.select("a")) {
            String text = StringUtils.normalizeSpace(a.text().replace(',', ' '));
            if (!text.isEmpty()) {
                crumbs.add(text);
            }
        }
        if (!crumbs.isEmpty() && crumbs.get(0).equals(props.getRootBreadcrumb())) {
            crumbs.set(0, props.getRootTerm());
        }
        return crumbs;
    }
}
