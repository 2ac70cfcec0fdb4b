package com.bricks.sorter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning knobs for the sorting pipeline.
 *
 * <p>Values are bound from properties prefixed with {@code sorter}:
 * <pre>
 * sorter:
 *   root-term: Lego
 *   fetch-concurrency: 10
 *   max-label-depth: 16
 *   kmeans:
 *     max-iterations: 300
 *     restarts: 4
 * </pre>
 * </p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sorter")
public class SorterProperties {

    /** Top-level taxonomy term shared by every part. */
    @NotBlank
    private String rootTerm = "Lego";

    /** Breadcrumb text the catalog shows for the root; rewritten to {@link #rootTerm}. */
    @NotBlank
    private String rootBreadcrumb = "The LEGO Parts Guide";

    /** Width of the worker pool used for cache-miss lookups. */
    @Min(1)
    @Max(64)
    private int fetchConcurrency = 10;

    /** Deepest breadcrumb level turned into a feature column. */
    @Min(1)
    private int maxLabelDepth = 16;

    /** Directory for uploads and materialized set inventories. */
    @NotBlank
    private String workDir = "./temp";

    /** Cluster count used when a request does not name one. */
    @Min(1)
    private int defaultClusters = 10;

    @Valid
    private KMeans kmeans = new KMeans();

    @Valid
    private RetrySettings retry = new RetrySettings();

    /**
     * Weighted k-means settings.
     */
    @Data
    public static class KMeans {

        /** Lloyd iterations per restart. */
        @Min(1)
        private int maxIterations = 300;

        /** Independent k-means++ seedings; the lowest inertia wins. */
        @Min(1)
        private int restarts = 4;
    }

    /**
     * Retry policy applied to every catalog lookup.
     */
    @Data
    public static class RetrySettings {

        /** Total attempts including the first call. */
        @Min(1)
        private int maxAttempts = 2;

        /** Pause between attempts. */
        private Duration waitDuration = Duration.ofMillis(300);
    }
}
