package com.culicidaelab.controller;

import com.culicidaelab.aspect.TimingAspect;
import com.culicidaelab.localization.CacheDomain;
import com.culicidaelab.model.result.ApiResponse;
import com.culicidaelab.service.LocalizationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Administrative operations on the translation cache
 */
@RestController
@RequestMapping("/api/admin/localization")
@Slf4j
public class LocalizationController {

    @Autowired
    private LocalizationService localizationService;

    @PostMapping("/reload")
    public ResponseEntity<ApiResponse<Map<CacheDomain, Integer>>> reload() {
        Map<CacheDomain, Integer> sizes = localizationService.reload();
        log.info("Localization cache reloaded: {}", sizes);
        return ResponseEntity.ok(ApiResponse.success(sizes, TimingAspect.getAndClearExecutionTime()));
    }
}
