package com.culicidaelab.controller;

import com.culicidaelab.model.Disease;
import com.culicidaelab.model.SpeciesDetail;
import com.culicidaelab.model.SpeciesList;
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
public class SpeciesController {

    @Autowired
    private SpeciesService speciesService;

    @Autowired
    private DiseaseService diseaseService;

    @GetMapping("/species")
    public ResponseEntity<SpeciesList> listSpecies(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(speciesService.listSpecies(lang, search, limit));
    }

    @GetMapping("/species/{id}")
    public ResponseEntity<SpeciesDetail> getSpecies(
            @PathVariable String id,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(speciesService.getSpecies(id, lang));
    }

    @GetMapping("/species/{id}/diseases")
    public ResponseEntity<List<Disease>> getSpeciesDiseases(
            @PathVariable String id,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(diseaseService.listDiseasesByVector(id, lang));
    }

    @GetMapping("/vector-species")
    public ResponseEntity<List<SpeciesSummary>> listVectorSpecies(
            @RequestParam(name = "disease_id", required = false) String diseaseId,
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(speciesService.listVectorSpecies(lang, diseaseId).getSpecies());
    }
}
