package com.daniel.eprec.eprecapi.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

// Body of /get_content_by_series_id: {"id_list": [13, 14]}.
public record SeriesIdListRequest(
        @JsonProperty("id_list") List<Long> idList
) {
}
