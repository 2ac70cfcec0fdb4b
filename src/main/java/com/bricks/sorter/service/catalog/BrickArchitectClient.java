package com.bricks.sorter.service.catalog;

import com.bricks.sorter.config.CatalogCfg;
import com.bricks.sorter.config.CatalogConfigFactory;
import com.bricks.sorter.error.RemoteLookupException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * <h2>BrickArchitect – part categories and images</h2>
 *
 * <p>Reads the breadcrumb trail of {@code /parts/{id}} and the PNG at
 * {@code /content/parts/{id}.png}. Part pages redirect alternate moulds to
 * their canonical id; the last path segment of the final URL is taken as the
 * resolved design id.</p>
 */
@Slf4j
@Service
public class BrickArchitectClient extends CatalogHttpEngine implements PartCatalogClient {

    private final BreadcrumbParser parser;

    @Autowired
    public BrickArchitectClient(final CatalogConfigFactory factory, final BreadcrumbParser parser) {
        super(factory.forCatalog(CatalogConfigFactory.BRICKARCHITECT));
        this.parser = parser;
    }

    BrickArchitectClient(final CatalogCfg cfg, final HttpClient http, final BreadcrumbParser parser) {
        super(cfg, http);
        this.parser = parser;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String catalog() {
        return "BrickArchitect";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public TaxonomyLookup lookupTaxonomy(final int designId) {
        HttpResponse<byte[]> rsp = httpGet(partUri(getCfg().getPartPath(), designId));

        List<String> labels = parser.parse(new String(rsp.body(), StandardCharsets.UTF_8));
        if (labels.isEmpty()) {
            throw new RemoteLookupException("No breadcrumbs on part page " + rsp.uri());
        }
        return new TaxonomyLookup(resolvedId(rsp.uri(), designId), labels);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public byte[] fetchImage(final int designId) {
        return httpGet(partUri(getCfg().getImagePath(), designId)).body();
    }

    /**
     * Last path segment of the final URL when it is a design id, else the queried id.
     */
    static int resolvedId(final URI finalUri, final int queriedId) {
        String path = StringUtils.removeEnd(finalUri.getPath(), "/");
        String last = StringUtils.substringAfterLast(path, "/");
        if (!StringUtils.isNumeric(last)) {
            log.debug("Part {} ended on non-numeric page {}", queriedId, finalUri);
            return queriedId;
        }
        try {
            int id = Integer.parseInt(last);
            return id > 0 ? id : queriedId;
        } catch (NumberFormatException ex) {
            return queriedId;
        }
    }
}
