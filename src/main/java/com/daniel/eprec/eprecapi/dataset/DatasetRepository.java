package com.daniel.eprec.eprecapi.dataset;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Repository;

/**
 * Row-level reads against an open snapshot connection.
 *
 * <p>
 * The caller owns the connection and the access ticket; this class only runs
 * statements and maps rows. Rows come back in scan order, which the
 * aggregators rely on as the tiebreak for their stable sorts.
 * SQL {@code NULL} text is read as an empty string so that such rows still
 * group and sort instead of being dropped.
 */
@Repository
public class DatasetRepository {

    public List<SeriesRecord> findAllSeries(Connection conn) {
        String sql = SqlLoader.load("select-all-series");
        try (PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            List<SeriesRecord> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(new SeriesRecord(
                        rs.getLong(1),
                        text(rs, 2),
                        text(rs, 3),
                        text(rs, 4)));
            }
            return rows;
        } catch (SQLException ex) {
            throw new QueryException("Series scan failed", ex);
        }
    }

    /**
     * Episodes whose {@code series_id} is in {@code seriesIds}. One bind
     * parameter per id; duplicates are harmless for an {@code IN} list.
     */
    public List<EpisodeRecord> findEpisodesBySeriesIds(Connection conn, List<Long> seriesIds) {
        if (seriesIds.isEmpty()) {
            return Collections.emptyList();
        }
        String sql = SqlLoader.loadWithInList("select-episodes-by-series-ids", seriesIds.size());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < seriesIds.size(); i++) {
                ps.setLong(i + 1, seriesIds.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<EpisodeRecord> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(new EpisodeRecord(
                            text(rs, 1),
                            text(rs, 2),
                            text(rs, 3),
                            text(rs, 4),
                            text(rs, 5),
                            rs.getLong(6)));
                }
                return rows;
            }
        } catch (SQLException ex) {
            throw new QueryException("Episode scan failed", ex);
        }
    }

    private static String text(ResultSet rs, int column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? "" : value;
    }
}
