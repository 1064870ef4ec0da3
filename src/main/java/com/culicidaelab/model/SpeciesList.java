package com.culicidaelab.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpeciesList {

    private int count;
    private List<SpeciesSummary> species;

    public static SpeciesList of(List<SpeciesSummary> species) {
        return new SpeciesList(species.size(), species);
    }
}
