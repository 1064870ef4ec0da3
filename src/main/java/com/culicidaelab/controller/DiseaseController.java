package com.culicidaelab.controller;

import com.culicidaelab.model.Disease;
import com.culicidaelab.model.DiseaseList;
import com.culicidaelab.model.SpeciesSummary;
import com.culicidaelab.service.DiseaseService;
import com.culicidaelab.service.SpeciesService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class DiseaseController {

    @Autowired
    private DiseaseService diseaseService;

    @Autowired
    private SpeciesService speciesService;

    @GetMapping("/diseases")
    public ResponseEntity<DiseaseList> listDiseases(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(diseaseService.listDiseases(lang, search, limit));
    }

    @GetMapping("/diseases/{id}")
    public ResponseEntity<Disease> getDisease(
            @PathVariable String id,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(diseaseService.getDisease(id, lang));
    }

    /**
     * Species that transmit the disease
     */
    @GetMapping("/diseases/{id}/vectors")
    public ResponseEntity<List<SpeciesSummary>> getDiseaseVectors(
            @PathVariable String id,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(speciesService.listVectorSpecies(lang, id).getSpecies());
    }
}
