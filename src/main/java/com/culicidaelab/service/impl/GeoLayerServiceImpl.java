package com.culicidaelab.service.impl;

import com.culicidaelab.aspect.Timed;
import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.geo.GeoFeatureFilterEngine;
import com.culicidaelab.geo.GeoFilter;
import com.culicidaelab.model.FeatureCollection;
import com.culicidaelab.model.GeoFeature;
import com.culicidaelab.model.GeoQuery;
import com.culicidaelab.model.LayerType;
import com.culicidaelab.service.GeoLayerService;
import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.QueryWindow;
import com.culicidaelab.store.Row;
import com.culicidaelab.store.StoreException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Geo layers. Only the observations layer is backed by data; the species filter and
 * the row limit are pushed down to the store, bbox and dates are applied by the engine.
 */
@Service
public class GeoLayerServiceImpl implements GeoLayerService {

    private static final Logger logger = LoggerFactory.getLogger(GeoLayerServiceImpl.class);

    static final String OBSERVATIONS_TABLE = "observations";

    private final DocumentStore documentStore;
    private final GeoFeatureFilterEngine filterEngine;
    private final CulicidaeLabProperties properties;
    private final Timer layerTimer;

    public GeoLayerServiceImpl(DocumentStore documentStore, GeoFeatureFilterEngine filterEngine,
                               CulicidaeLabProperties properties, MeterRegistry meterRegistry) {
        this.documentStore = documentStore;
        this.filterEngine = filterEngine;
        this.properties = properties;
        this.layerTimer = Timer.builder("culicidaelab.geo.layer_duration")
                .description("Geo layer query and filtering time")
                .register(meterRegistry);
    }

    @Override
    @Timed("getGeoLayer")
    public FeatureCollection getGeoLayer(GeoQuery query) {
        if (query.getLayerType() != LayerType.OBSERVATIONS) {
            return FeatureCollection.empty();
        }

        Timer.Sample sample = Timer.start();
        try {
            int limit = query.getLimit() > 0 ? query.getLimit() : properties.getGeo().getDefaultLimit();
            QueryPredicate predicate = null;
            if (query.getSpecies() != null && !query.getSpecies().isEmpty()) {
                predicate = QueryPredicate.in(GeoFeatureFilterEngine.SPECIES_SCIENTIFIC_NAME, query.getSpecies());
            }

            List<Row> rows = documentStore.openTable(OBSERVATIONS_TABLE)
                    .query(predicate, QueryWindow.limit(limit));

            GeoFilter filter = GeoFilter.builder()
                    .species(query.getSpecies() != null
                            ? new LinkedHashSet<>(query.getSpecies()) : new LinkedHashSet<>())
                    .bbox(query.getBbox())
                    .startDate(query.getStartDate())
                    .endDate(query.getEndDate())
                    .build();

            List<GeoFeature> features = filterEngine.filter(rows, filter);
            logger.debug("Geo layer {}: {} of {} rows matched", query.getLayerType(), features.size(), rows.size());
            return new FeatureCollection(features);
        } catch (StoreException e) {
            logger.warn("Geo layer {} unavailable, returning empty collection: {}",
                    query.getLayerType(), e.getMessage());
            return FeatureCollection.empty();
        } finally {
            sample.stop(layerTimer);
        }
    }
}
