package com.daniel.eprec.eprecapi.web;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

import java.util.List;
import java.util.SortedMap;

import org.springframework.web.bind.annotation.RequestBody; // Binds the JSON body (GET or POST) to the request record.
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.daniel.eprec.eprecapi.query.CatalogQueryService;

@RestController
public class ContentController {

    private final CatalogQueryService catalogQueryService;

    public ContentController(CatalogQueryService catalogQueryService) {
        this.catalogQueryService = catalogQueryService;
    }

    // {"Ep": ["newest abstract", "second", "third"], ...}; an empty id_list answers {}.
    @RequestMapping(path = "/get_content_by_series_id", method = {RequestMethod.GET, RequestMethod.POST})
    public SortedMap<String, List<String>> contentBySeriesId(@RequestBody SeriesIdListRequest request) {
        if (request.idList() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "id_list is required");
        }
        if (request.idList().contains(null)) {
            throw new ResponseStatusException(BAD_REQUEST, "id_list must not contain null");
        }
        return catalogQueryService.latestAbstractsBySeriesIds(request.idList());
    }
}
