package com.daniel.eprec.eprecapi.dataset;

// One row of series_data. year/month are kept as text exactly as stored.
public record SeriesRecord(
        long id,
        String name,
        String year,
        String month
) {
}
