package com.culicidaelab.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiseaseList {

    private int count;
    private List<Disease> diseases;

    public static DiseaseList of(List<Disease> diseases) {
        return new DiseaseList(diseases.size(), diseases);
    }
}
