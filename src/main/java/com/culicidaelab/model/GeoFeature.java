package com.culicidaelab.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GeoJSON Feature built per request from a store row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "properties", "geometry"})
@JsonIgnoreProperties(value = "type", allowGetters = true)
public class GeoFeature {

    public static final String TYPE = "Feature";

    /**
     * Row id; carried in properties on the wire
     */
    @JsonIgnore
    private String id;

    private Geometry geometry;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }
}
