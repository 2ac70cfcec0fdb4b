package com.bricks.sorter.cache;

import com.bricks.sorter.error.CacheIntegrityException;
import com.bricks.sorter.model.CacheEntry;
import com.bricks.sorter.model.PartImage;
import com.bricks.sorter.model.StaleImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local cache of catalog metadata, one row per design id.
 *
 * <p>Labels are stored comma-joined (breadcrumb terms never contain commas,
 * see {@code BreadcrumbParser}). Rows are never deleted and their labels are
 * never refreshed; only a missing image is retried, at most once a day.</p>
 */
@Slf4j
@Repository
public class PartCacheRepository {

    static final String LABEL_SEPARATOR = ",";

    private static final String SELECT_BY_IDS = """
            SELECT design_id, labels, image, updated
              FROM parts
             WHERE design_id IN (:ids)
            """;

    private static final String UPSERT = """
            MERGE INTO parts (design_id, labels, image, updated)
            KEY (design_id)
            VALUES (:designId, :labels, :image, :updated)
            """;

    private static final String SELECT_STALE = """
            SELECT design_id, updated
              FROM parts
             WHERE image IS NULL
               AND design_id IN (:ids)
             ORDER BY design_id
            """;

    private static final String UPDATE_IMAGE = """
            UPDATE parts
               SET image = :image, updated = :updated
             WHERE design_id = :designId
            """;

    private static final String SELECT_IMAGES = """
            SELECT design_id, image
              FROM parts
             WHERE design_id IN (:ids)
             ORDER BY design_id
            """;

    private static final RowMapper<CacheEntry> ENTRY_MAPPER = (rs, n) -> new CacheEntry(
            rs.getInt("design_id"),
            splitLabels(rs.getString("labels")),
            rs.getBytes("image"),
            rs.getDate("updated").toLocalDate());

    private final NamedParameterJdbcTemplate jdbc;

    private final Clock clock;

    public PartCacheRepository(final NamedParameterJdbcTemplate jdbc, final Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    /**
     * Left join of the given ids against the cache.
     *
     * @param ids design ids
     * @return entries for the ids present; missing ids are simply absent
     */
    public Map<Integer, CacheEntry> get(final Collection<Integer> ids) {
        Map<Integer, CacheEntry> out = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return out;
        }
        for (CacheEntry e : jdbc.query(SELECT_BY_IDS, new MapSqlParameterSource("ids", ids), ENTRY_MAPPER)) {
            out.put(e.designId(), e);
        }
        return out;
    }

    /**
     * Inserts or replaces a batch of entries.
     *
     * @param entries entries with distinct design ids
     * @throws CacheIntegrityException if a design id occurs twice in the batch
     */
    @Transactional
    public void putMany(final List<CacheEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        Set<Integer> seen = new HashSet<>();
        for (CacheEntry e : entries) {
            if (!seen.add(e.designId())) {
                log.error("Design id {} occurs twice in one cache batch", e.designId());
                throw new CacheIntegrityException("Duplicate design id " + e.designId() + " in cache batch");
            }
        }

        SqlParameterSource[] batch = entries.stream()
                .map(e -> new MapSqlParameterSource()
                        .addValue("designId", e.designId())
                        .addValue("labels", String.join(LABEL_SEPARATOR, e.labels()))
                        .addValue("image", e.image(), Types.VARBINARY)
                        .addValue("updated", Date.valueOf(e.updated())))
                .toArray(SqlParameterSource[]::new);
        int[] counts = jdbc.batchUpdate(UPSERT, batch);
        log.debug("Cached {} parts ({} rows affected)", entries.size(), Arrays.stream(counts).sum());
    }

    /**
     * @param ids design ids of the working set
     * @return cached rows among {@code ids} that still have no image, ascending
     */
    public List<StaleImage> getStaleImageCandidates(final Collection<Integer> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query(SELECT_STALE, new MapSqlParameterSource("ids", ids),
                (rs, n) -> new StaleImage(rs.getInt("design_id"), rs.getDate("updated").toLocalDate()));
    }

    /**
     * Stores the outcome of an image retry and stamps the row with today's date,
     * also when {@code image} is still {@code null}.
     *
     * @param designId cache key
     * @param image    PNG bytes or {@code null}
     */
    public void updateImage(final int designId, final byte[] image) {
        jdbc.update(UPDATE_IMAGE, new MapSqlParameterSource()
                .addValue("designId", designId)
                .addValue("image", image, Types.VARBINARY)
                .addValue("updated", Date.valueOf(LocalDate.now(clock))));
    }

    /**
     * @param ids design ids
     * @return cached images of the ids present, ascending by design id
     */
    public List<PartImage> getImages(final Collection<Integer> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query(SELECT_IMAGES, new MapSqlParameterSource("ids", ids),
                (rs, n) -> new PartImage(rs.getInt("design_id"), rs.getBytes("image")));
    }

    static List<String> splitLabels(final String joined) {
        return List.of(joined.split(LABEL_SEPARATOR));
    }
}
