package com.daniel.eprec.eprecapi.aggregate;

import com.fasterxml.jackson.annotation.JsonProperty;

// Client-facing entry of a period bucket: {"id": 1, "series_name": "Alpha"}.
public record SeriesItem(
        long id,
        @JsonProperty("series_name") String seriesName
) {
}
