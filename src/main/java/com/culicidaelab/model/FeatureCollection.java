package com.culicidaelab.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * GeoJSON FeatureCollection
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "features"})
@JsonIgnoreProperties(value = "type", allowGetters = true)
public class FeatureCollection {

    public static final String TYPE = "FeatureCollection";

    private List<GeoFeature> features = new ArrayList<>();

    public static FeatureCollection empty() {
        return new FeatureCollection(new ArrayList<>());
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    public int size() {
        return features.size();
    }
}
