package com.culicidaelab.service;

import com.culicidaelab.model.FeatureCollection;
import com.culicidaelab.model.GeoQuery;

public interface GeoLayerService {

    /**
     * Features of one map layer after species, bounding-box and date filtering.
     * Never fails: store errors yield an empty collection.
     */
    FeatureCollection getGeoLayer(GeoQuery query);
}
