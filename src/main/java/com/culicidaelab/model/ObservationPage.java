package com.culicidaelab.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * One page of an observation listing; count is the total number of matches
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationPage {

    private long count;

    @Builder.Default
    private List<Observation> observations = Collections.emptyList();

    public static ObservationPage empty() {
        return new ObservationPage(0, Collections.emptyList());
    }
}
