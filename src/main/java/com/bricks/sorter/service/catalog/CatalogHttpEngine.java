package com.bricks.sorter.service.catalog;

import com.bricks.sorter.config.CatalogCfg;
import com.bricks.sorter.error.RemoteLookupException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * <h2>CatalogHttpEngine</h2>
 *
 * <p>Base class for catalogs that are scraped with plain <strong>single
 * GET</strong> requests (HTML pages, static images).</p>
 *
 * <ul>
 *   <li>Shares one redirect-following {@link HttpClient}; the final URL of a
 *       redirect chain is available on the response.</li>
 *   <li>Transport failures surface as {@link UncheckedIOException} so the
 *       retry policy can tell them from definitive HTTP errors.</li>
 *   <li>Non-2xx responses raise {@link RemoteLookupException}.</li>
 * </ul>
 */
@Slf4j
@Getter
public abstract class CatalogHttpEngine {

    /** Nanoseconds per millisecond, for the phase timing log lines. */
    public static final Long MILLISECONDS_VALUE = 1_000_000L;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; BrickSorter/1.0)";

    private final CatalogCfg cfg;

    /** Shared immutable {@link HttpClient}. */
    private final HttpClient http;

    protected CatalogHttpEngine(final CatalogCfg cfg) {
        this(cfg, HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build());
    }

    protected CatalogHttpEngine(final CatalogCfg cfg, final HttpClient http) {
        this.cfg = cfg;
        this.http = http;
    }

    /** The canonical catalog root URL (no trailing slash). */
    protected final String baseUrl() {
        return StringUtils.removeEnd(cfg.getBaseUrl(), "/");
    }

    /**
     * Expands a path template such as {@code /parts/{part}} against the base URL.
     */
    protected URI partUri(final String pathTemplate, final int designId) {
        return UriComponentsBuilder.fromUriString(baseUrl())
                .path(pathTemplate)
                .buildAndExpand(designId)
                .encode()
                .toUri();
    }

    /**
     * Perform a <strong>single GET</strong>.
     *
     * @param uri absolute URI
     * @return the 2xx response; {@link HttpResponse#uri()} is the final URI after redirects
     * @throws RemoteLookupException for non-2xx responses
     * @throws UncheckedIOException  for transport failures and timeouts
     */
    protected HttpResponse<byte[]> httpGet(final URI uri) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(cfg.getTimeout())
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        HttpResponse<byte[]> rsp;
        try {
            rsp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException ex) {
            throw new UncheckedIOException("GET " + uri + " failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RemoteLookupException("GET " + uri + " interrupted", ex);
        }

        int code = rsp.statusCode();
        if (code / 100 != 2) {
            throw new RemoteLookupException("HTTP " + code + " for " + uri);
        }
        log.debug("<-- {} {} ({} bytes)", code, rsp.uri(), rsp.body().length);
        return rsp;
    }
}
