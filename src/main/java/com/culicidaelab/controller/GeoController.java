package com.culicidaelab.controller;

import com.culicidaelab.exception.InvalidQueryParameterException;
import com.culicidaelab.geo.IsoDates;
import com.culicidaelab.model.BoundingBox;
import com.culicidaelab.model.FeatureCollection;
import com.culicidaelab.model.GeoQuery;
import com.culicidaelab.model.LayerType;
import com.culicidaelab.service.GeoLayerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * GeoJSON map layers.
 * HTTP: GET /api/geo/{layerType}?species=a,b&amp;bbox=minLon,minLat,maxLon,maxLat&amp;start_date=&amp;end_date=
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class GeoController {

    @Autowired
    private GeoLayerService geoLayerService;

    @GetMapping("/geo/{layerType}")
    public ResponseEntity<FeatureCollection> getGeoLayer(
            @PathVariable String layerType,
            @RequestParam(required = false) String species,
            @RequestParam(required = false) String bbox,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate,
            @RequestParam(required = false) Integer limit) {

        GeoQuery query = GeoQuery.builder()
                .layerType(parseLayerType(layerType))
                .species(parseSpecies(species))
                .bbox(parseBbox(bbox))
                .startDate(parseDate("start_date", startDate))
                .endDate(parseDate("end_date", endDate))
                .limit(parseLimit(limit))
                .build();

        if (query.getStartDate() != null && query.getEndDate() != null
                && query.getStartDate().isAfter(query.getEndDate())) {
            throw new InvalidQueryParameterException("start_date", "must not be after end_date");
        }

        log.debug("Geo layer request: {}", query);
        return ResponseEntity.ok(geoLayerService.getGeoLayer(query));
    }

    private static LayerType parseLayerType(String layerType) {
        return LayerType.fromPath(layerType).orElseThrow(() -> new InvalidQueryParameterException("layer_type",
                "must be one of " + Arrays.stream(LayerType.values())
                        .map(LayerType::getPath)
                        .collect(Collectors.joining(", "))));
    }

    private static List<String> parseSpecies(String species) {
        List<String> names = new ArrayList<>();
        if (species == null) {
            return names;
        }
        for (String name : species.split(",")) {
            if (!name.trim().isEmpty()) {
                names.add(name.trim());
            }
        }
        return names;
    }

    private static BoundingBox parseBbox(String bbox) {
        if (bbox == null || bbox.isBlank()) {
            return null;
        }
        try {
            return BoundingBox.parse(bbox);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryParameterException("bbox", e.getMessage());
        }
    }

    private static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return IsoDates.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryParameterException(name, "expected YYYY-MM-DD, got '" + value + "'");
        }
    }

    private static int parseLimit(Integer limit) {
        if (limit == null) {
            return 0;
        }
        if (limit <= 0) {
            throw new InvalidQueryParameterException("limit", "must be positive");
        }
        return limit;
    }
}
