package com.daniel.eprec.eprecapi.dataset;

// One row of ep_data. Ordering fields stay strings; EpisodeAggregator compares them lexicographically.
public record EpisodeRecord(
        String episodeName,
        String year,
        String month,
        String episodeNum,
        String abstractText,
        long seriesId
) {
}
