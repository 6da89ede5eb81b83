package com.daniel.eprec.eprecapi.aggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.daniel.eprec.eprecapi.dataset.EpisodeRecord;

/**
 * Groups episodes by name and keeps the abstracts of the newest
 * {@value #WINDOW_SIZE} entries of each group.
 *
 * <p>
 * "Newest" is {@code (year, month, episode_num)} descending with each component
 * compared as a plain string by code point, so month "9" ranks above month "10". That is the
 * ordering clients have always seen; it is not parsed into numbers here.
 * Entries with identical keys keep their scan order.
 */
@Service
public class EpisodeAggregator {

    public static final int WINDOW_SIZE = 3;

    static final Comparator<EpisodeRecord> NEWEST_FIRST = Comparator
            .comparing(EpisodeRecord::year, CodePointOrder.INSTANCE)
            .thenComparing(EpisodeRecord::month, CodePointOrder.INSTANCE)
            .thenComparing(EpisodeRecord::episodeNum, CodePointOrder.INSTANCE)
            .reversed();

    public SortedMap<String, List<String>> aggregate(List<EpisodeRecord> records) {
        Map<String, List<EpisodeRecord>> byName = new LinkedHashMap<>();
        for (EpisodeRecord record : records) {
            byName.computeIfAbsent(record.episodeName(), name -> new ArrayList<>()).add(record);
        }

        SortedMap<String, List<String>> abstracts = new TreeMap<>(CodePointOrder.INSTANCE);
        byName.forEach((name, group) -> {
            group.sort(NEWEST_FIRST);
            abstracts.put(name, group.stream()
                    .limit(WINDOW_SIZE)
                    .map(EpisodeRecord::abstractText)
                    .toList());
        });
        return abstracts;
    }
}
