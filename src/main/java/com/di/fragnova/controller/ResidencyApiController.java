package com.di.fragnova.controller;

import com.di.fragnova.controller.dto.EpochRequest;
import com.di.fragnova.descriptor.DescriptorDocument;
import com.di.fragnova.descriptor.DescriptorLoader;
import com.di.fragnova.residency.EpochReport;
import com.di.fragnova.residency.PlanApplication;
import com.di.fragnova.residency.ResidencySnapshot;
import com.di.fragnova.service.ResidencyInitialization;
import com.di.fragnova.service.ResidencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Drives the residency controller over HTTP.
 * <ul>
 *   <li>POST /api/residency/initialize: plan a descriptor and seed the controller</li>
 *   <li>POST /api/residency/epochs: advance one epoch with the given accesses</li>
 *   <li>POST /api/residency/rebalance: replan a descriptor and migrate toward it</li>
 *   <li>GET /api/residency: current snapshot</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/residency")
@RequiredArgsConstructor
public class ResidencyApiController {

    private final DescriptorLoader descriptorLoader;
    private final ResidencyService residencyService;

    @PostMapping(value = "/initialize", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResidencyInitialization> initialize(@RequestBody DescriptorDocument document) {
        return ResponseEntity.ok(residencyService.initialize(descriptorLoader.validate(document)));
    }

    @PostMapping(value = "/epochs", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EpochReport> step(@Valid @RequestBody EpochRequest request) {
        EpochReport report = residencyService.step(request.getAccessed());
        log.debug("[RESIDENCY-API] Epoch {} done, {} migration(s)", report.getEpoch(), report.getMigrations().size());
        return ResponseEntity.ok(report);
    }

    @PostMapping(value = "/rebalance", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlanApplication> rebalance(@RequestBody DescriptorDocument document) {
        return ResponseEntity.ok(residencyService.rebalance(descriptorLoader.validate(document)));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResidencySnapshot> snapshot() {
        return ResponseEntity.ok(residencyService.snapshot());
    }
}
