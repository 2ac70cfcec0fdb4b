package com.bricks.sorter.cache;

import com.bricks.sorter.error.CacheIntegrityException;
import com.bricks.sorter.model.CacheEntry;
import com.bricks.sorter.model.PartImage;
import com.bricks.sorter.model.StaleImage;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against an in-memory H2 database migrated with the production Flyway scripts.
 */
@DisplayName("PartCacheRepository")
class PartCacheRepositoryTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    private PartCacheRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource ds = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        Flyway.configure().dataSource(ds).load().migrate();

        Clock clock = Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC);
        repository = new PartCacheRepository(new NamedParameterJdbcTemplate(ds), clock);
    }

    @Test
    @DisplayName("get is a left join: unknown ids are absent")
    void leftJoin() {
        // given
        repository.putMany(List.of(
                new CacheEntry(3001, List.of("Lego", "1. Basic", "Bricks"), PNG, TODAY)));

        // when
        Map<Integer, CacheEntry> hits = repository.get(List.of(3001, 3002));

        // then
        assertThat(hits).containsOnlyKeys(3001);
        CacheEntry e = hits.get(3001);
        assertThat(e.labels()).containsExactly("Lego", "1. Basic", "Bricks");
        assertThat(e.image()).isEqualTo(PNG);
        assertThat(e.updated()).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("get of no ids returns nothing")
    void emptyGet() {
        assertThat(repository.get(List.of())).isEmpty();
    }

    @Test
    @DisplayName("putMany replaces an existing row")
    void upsert() {
        repository.putMany(List.of(new CacheEntry(3001, List.of("Lego"), null, TODAY.minusDays(3))));
        repository.putMany(List.of(new CacheEntry(3001, List.of("Lego", "Bricks"), PNG, TODAY)));

        CacheEntry e = repository.get(List.of(3001)).get(3001);

        assertThat(e.labels()).containsExactly("Lego", "Bricks");
        assertThat(e.hasImage()).isTrue();
    }

    @Test
    @DisplayName("putMany refuses a design id twice in one batch and writes nothing")
    void duplicateInBatch() {
        List<CacheEntry> batch = List.of(
                new CacheEntry(3001, List.of("Lego"), null, TODAY),
                new CacheEntry(3002, List.of("Lego"), null, TODAY),
                new CacheEntry(3001, List.of("Lego", "Bricks"), null, TODAY));

        assertThatThrownBy(() -> repository.putMany(batch))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("3001");
        assertThat(repository.get(List.of(3001, 3002))).isEmpty();
    }

    @Test
    @DisplayName("stale candidates are the rows without image")
    void staleCandidates() {
        repository.putMany(List.of(
                new CacheEntry(3001, List.of("Lego"), PNG, TODAY),
                new CacheEntry(3002, List.of("Lego"), null, TODAY.minusDays(1)),
                new CacheEntry(3003, List.of("Lego"), null, TODAY)));

        List<StaleImage> stale = repository.getStaleImageCandidates(List.of(3001, 3002, 3003, 4000));

        assertThat(stale).containsExactly(
                new StaleImage(3002, TODAY.minusDays(1)),
                new StaleImage(3003, TODAY));
    }

    @Test
    @DisplayName("updateImage stamps today even when the image is still missing")
    void updateImageStampsToday() {
        repository.putMany(List.of(
                new CacheEntry(3002, List.of("Lego"), null, TODAY.minusDays(5)),
                new CacheEntry(3003, List.of("Lego"), null, TODAY.minusDays(5))));

        repository.updateImage(3002, PNG);
        repository.updateImage(3003, null);

        Map<Integer, CacheEntry> rows = repository.get(List.of(3002, 3003));
        assertThat(rows.get(3002).image()).isEqualTo(PNG);
        assertThat(rows.get(3002).updated()).isEqualTo(TODAY);
        assertThat(rows.get(3003).image()).isNull();
        assertThat(rows.get(3003).updated()).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("getImages returns ascending design ids")
    void imagesAscending() {
        repository.putMany(List.of(
                new CacheEntry(3003, List.of("Lego"), PNG, TODAY),
                new CacheEntry(3001, List.of("Lego"), null, TODAY)));

        List<PartImage> images = repository.getImages(List.of(3003, 3001, 9999));

        assertThat(images).extracting(PartImage::designId).containsExactly(3001, 3003);
        assertThat(images.get(0).image()).isNull();
    }
}
