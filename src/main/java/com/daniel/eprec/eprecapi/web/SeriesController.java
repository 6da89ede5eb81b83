package com.daniel.eprec.eprecapi.web;

import java.util.List;
import java.util.SortedMap;

import org.springframework.web.bind.annotation.RequestMapping; // Maps one path to several HTTP methods.
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import com.daniel.eprec.eprecapi.aggregate.SeriesItem;
import com.daniel.eprec.eprecapi.query.CatalogQueryService;

@RestController
// GET and POST behave the same; any request body is ignored.
public class SeriesController {

    private final CatalogQueryService catalogQueryService;

    public SeriesController(CatalogQueryService catalogQueryService) {
        this.catalogQueryService = catalogQueryService;
    }

    // {"202103": [{"id": 1, "series_name": "Alpha"}, ...], ...} with keys in ascending order.
    @RequestMapping(path = "/series_with_year_month", method = {RequestMethod.GET, RequestMethod.POST})
    public SortedMap<String, List<SeriesItem>> seriesWithYearMonth() {
        return catalogQueryService.seriesByPeriod();
    }
}
