package com.culicidaelab.controller;

import com.culicidaelab.model.FilterOptions;
import com.culicidaelab.service.FilterOptionsService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Options for the map filter panel
 */
@RestController
@RequestMapping("/api")
public class FilterController {

    @Autowired
    private FilterOptionsService filterOptionsService;

    @GetMapping("/filter_options")
    public ResponseEntity<FilterOptions> getFilterOptions(
            @RequestParam(name = "lang", defaultValue = "en") String lang) {
        return ResponseEntity.ok(filterOptionsService.getFilterOptions(lang));
    }
}
