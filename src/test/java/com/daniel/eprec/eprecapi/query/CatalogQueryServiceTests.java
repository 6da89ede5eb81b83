package com.daniel.eprec.eprecapi.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.daniel.eprec.eprecapi.access.AccessTicket;
import com.daniel.eprec.eprecapi.access.DatasetAccessCoordinator;
import com.daniel.eprec.eprecapi.aggregate.EpisodeAggregator;
import com.daniel.eprec.eprecapi.aggregate.PeriodAggregator;
import com.daniel.eprec.eprecapi.aggregate.SeriesItem;
import com.daniel.eprec.eprecapi.dataset.DatasetFixtures;
import com.daniel.eprec.eprecapi.dataset.DatasetHandle;
import com.daniel.eprec.eprecapi.dataset.DatasetRepository;
import com.daniel.eprec.eprecapi.dataset.SeriesRecord;
import com.daniel.eprec.eprecapi.dataset.StorageOpenException;

class CatalogQueryServiceTests {

    @TempDir
    Path tempDir;

    private final DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();

    @Test
    void seriesByPeriodReadsCurrentSnapshot() {
        Path db = DatasetFixtures.createDatabase(tempDir.resolve("data.db"), DatasetFixtures.sampleSeries(), List.of());

        SortedMap<String, List<SeriesItem>> view = service(db).seriesByPeriod();

        assertEquals(List.of(new SeriesItem(1, "Alpha"), new SeriesItem(2, "Beta")), view.get("202103"));
        assertEquals(List.of(new SeriesItem(3, "Gamma")), view.get("202111"));
        assertFalse(coordinator.isHeld());
    }

    @Test
    void latestAbstractsFiltersBySeriesAndKeepsWindow() {
        Path db = DatasetFixtures.createDatabase(tempDir.resolve("data.db"), List.of(), DatasetFixtures.sampleEpisodes());

        SortedMap<String, List<String>> view = service(db).latestAbstractsBySeriesIds(List.of(1L));

        assertEquals(Set.of("Ep"), view.keySet());
        assertEquals(List.of("may-2021", "feb-2021", "jan-2020"), view.get("Ep"));
    }

    // Empty id list answers without the ticket: even a held coordinator and a missing snapshot don't matter.
    @Test
    void emptyIdListNeverTouchesStorage() {
        CatalogQueryService service = service(tempDir.resolve("missing.db"));
        try (AccessTicket ticket = coordinator.acquire()) {
            SortedMap<String, List<String>> view = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> service.latestAbstractsBySeriesIds(List.of()));
            assertTrue(view.isEmpty());
        }
    }

    // A failed open must still hand the ticket back, otherwise the whole service stalls.
    @Test
    void ticketIsReleasedWhenSnapshotIsMissing() {
        CatalogQueryService service = service(tempDir.resolve("missing.db"));

        assertThrows(StorageOpenException.class, service::seriesByPeriod);
        assertFalse(coordinator.isHeld());
        assertThrows(StorageOpenException.class, () -> service.latestAbstractsBySeriesIds(List.of(1L)));
        assertFalse(coordinator.isHeld());
    }

    /*
     * Readers race a refresher that swaps the snapshot file between two generations.
     * Every response must come from exactly one generation, and every reader must finish.
     */
    @Test
    void concurrentQueriesNeverMixSnapshotGenerations() throws Exception {
        Path gen1 = DatasetFixtures.createDatabase(tempDir.resolve("gen1.db"), generation("g1"), List.of());
        Path gen2 = DatasetFixtures.createDatabase(tempDir.resolve("gen2.db"), generation("g2"), List.of());
        Path live = tempDir.resolve("data.db");
        Files.copy(gen1, live);
        CatalogQueryService service = service(live);

        ExecutorService pool = Executors.newFixedThreadPool(9);
        try {
            Future<?> refresher = pool.submit(() -> {
                for (int i = 0; i < 20; i++) {
                    try (AccessTicket ticket = coordinator.acquire()) {
                        Files.copy(i % 2 == 0 ? gen2 : gen1, live, StandardCopyOption.REPLACE_EXISTING);
                    }
                    Thread.yield();
                }
                return null;
            });

            List<Future<Set<String>>> readers = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                readers.add(pool.submit(() -> service.seriesByPeriod().values().stream()
                        .flatMap(List::stream)
                        .map(item -> item.seriesName().substring(0, 2))
                        .collect(Collectors.toSet())));
            }

            refresher.get(30, TimeUnit.SECONDS);
            for (Future<Set<String>> reader : readers) {
                Set<String> generations = reader.get(30, TimeUnit.SECONDS);
                assertEquals(1, generations.size(), "response mixed generations: " + generations);
            }
        } finally {
            pool.shutdownNow();
        }
        assertFalse(coordinator.isHeld());
    }

    private static List<SeriesRecord> generation(String prefix) {
        List<SeriesRecord> rows = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            rows.add(new SeriesRecord(i, prefix + "-series-" + i, "2021", String.valueOf(1 + i % 12)));
        }
        return rows;
    }

    private CatalogQueryService service(Path databasePath) {
        return new CatalogQueryService(
                coordinator,
                new DatasetHandle(databasePath),
                new DatasetRepository(),
                new PeriodAggregator(),
                new EpisodeAggregator());
    }
}
