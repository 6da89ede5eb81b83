package com.daniel.eprec.eprecapi.aggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import com.daniel.eprec.eprecapi.dataset.SeriesRecord;

@Service
public class PeriodAggregator {

    private static final Comparator<SeriesItem> BY_NAME = Comparator.comparing(SeriesItem::seriesName, CodePointOrder.INSTANCE);

    /*
     * 1) bucket every record under PeriodKey.of(year, month), scan order inside a bucket,
     * 2) sort each bucket by series name; List.sort is stable, so equal names keep scan order.
     * The TreeMap gives ascending key order when Jackson writes the JSON object.
     * Keys and names compare by code point, never by UTF-16 unit.
     * Nothing is filtered: every record lands in exactly one bucket.
     */
    public SortedMap<String, List<SeriesItem>> aggregate(List<SeriesRecord> records) {
        SortedMap<String, List<SeriesItem>> byPeriod = new TreeMap<>(CodePointOrder.INSTANCE);
        for (SeriesRecord record : records) {
            byPeriod.computeIfAbsent(PeriodKey.of(record.year(), record.month()), key -> new ArrayList<>())
                    .add(new SeriesItem(record.id(), record.name()));
        }
        byPeriod.values().forEach(items -> items.sort(BY_NAME));
        return byPeriod;
    }
}
