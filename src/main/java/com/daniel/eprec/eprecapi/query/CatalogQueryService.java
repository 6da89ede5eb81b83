package com.daniel.eprec.eprecapi.query;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.daniel.eprec.eprecapi.access.AccessTicket;
import com.daniel.eprec.eprecapi.access.DatasetAccessCoordinator;
import com.daniel.eprec.eprecapi.aggregate.EpisodeAggregator;
import com.daniel.eprec.eprecapi.aggregate.PeriodAggregator;
import com.daniel.eprec.eprecapi.aggregate.SeriesItem;
import com.daniel.eprec.eprecapi.dataset.DatasetHandle;
import com.daniel.eprec.eprecapi.dataset.DatasetRepository;
import com.daniel.eprec.eprecapi.dataset.EpisodeRecord;
import com.daniel.eprec.eprecapi.dataset.QueryException;
import com.daniel.eprec.eprecapi.dataset.SeriesRecord;

@Service
public class CatalogQueryService {

    /*
     * Request flow for both read shapes:
     * 1) take the coordinator ticket (waits while a refresh or another query holds it),
     * 2) open a fresh connection on the current snapshot,
     * 3) scan + aggregate,
     * 4) close the connection and release the ticket, on success and on failure.
     * The ticket covers aggregation too, so a response never mixes two snapshot generations.
     * Nothing is cached between requests.
     */
    private static final Logger log = LoggerFactory.getLogger(CatalogQueryService.class);

    private final DatasetAccessCoordinator coordinator;
    private final DatasetHandle datasetHandle;
    private final DatasetRepository repository;
    private final PeriodAggregator periodAggregator;
    private final EpisodeAggregator episodeAggregator;

    public CatalogQueryService(
            DatasetAccessCoordinator coordinator,
            DatasetHandle datasetHandle,
            DatasetRepository repository,
            PeriodAggregator periodAggregator,
            EpisodeAggregator episodeAggregator) {
        this.coordinator = coordinator;
        this.datasetHandle = datasetHandle;
        this.repository = repository;
        this.periodAggregator = periodAggregator;
        this.episodeAggregator = episodeAggregator;
    }

    public SortedMap<String, List<SeriesItem>> seriesByPeriod() {
        try (AccessTicket ticket = coordinator.acquire();
                Connection conn = datasetHandle.open()) {
            List<SeriesRecord> rows = repository.findAllSeries(conn);
            log.debug("Aggregating {} series rows by period", rows.size());
            return periodAggregator.aggregate(rows);
        } catch (SQLException ex) {
            // Only reachable from Connection.close().
            throw new QueryException("Closing snapshot connection failed", ex);
        }
    }

    public SortedMap<String, List<String>> latestAbstractsBySeriesIds(List<Long> seriesIds) {
        // Empty filter: answer without waiting on the coordinator or touching the snapshot.
        if (seriesIds == null || seriesIds.isEmpty()) {
            return new TreeMap<>();
        }
        try (AccessTicket ticket = coordinator.acquire();
                Connection conn = datasetHandle.open()) {
            List<EpisodeRecord> rows = repository.findEpisodesBySeriesIds(conn, seriesIds);
            log.debug("Aggregating {} episode rows for {} series ids", rows.size(), seriesIds.size());
            return episodeAggregator.aggregate(rows);
        } catch (SQLException ex) {
            throw new QueryException("Closing snapshot connection failed", ex);
        }
    }
}
