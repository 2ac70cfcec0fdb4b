package com.bricks.sorter.service.enrich;

import com.bricks.sorter.cache.PartCacheRepository;
import com.bricks.sorter.model.StaleImage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Retries missing part images, at most once per part and day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleImageRefresher {

    private final PartCacheRepository cache;

    private final EnrichmentFetcher fetcher;

    private final Clock clock;

    /**
     * @param designIds design ids of the working set
     * @return number of image downloads attempted
     */
    public int refresh(final Collection<Integer> designIds) {
        LocalDate today = LocalDate.now(clock);
        List<StaleImage> due = cache.getStaleImageCandidates(designIds).stream()
                .filter(s -> s.lastUpdated().isBefore(today))
                .toList();
        if (due.isEmpty()) {
            return 0;
        }

        int recovered = 0;
        for (StaleImage s : due) {
            byte[] image = fetcher.fetchImageOrNull(s.designId());
            cache.updateImage(s.designId(), image);
            if (image != null) {
                recovered++;
            }
        }
        log.info("Retried {} missing images, {} recovered", due.size(), recovered);
        return due.size();
    }
}
