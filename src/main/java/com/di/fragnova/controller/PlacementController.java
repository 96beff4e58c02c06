package com.di.fragnova.controller;

import com.di.fragnova.descriptor.DescriptorDocument;
import com.di.fragnova.descriptor.DescriptorLoader;
import com.di.fragnova.placement.PlacementPlan;
import com.di.fragnova.service.PlacementService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stateless planning endpoint.
 *
 * Example: POST /api/placement/plan with a descriptor body.
 */
@RestController
@RequestMapping("/api/placement")
@RequiredArgsConstructor
public class PlacementController {

    private final DescriptorLoader descriptorLoader;
    private final PlacementService placementService;

    @PostMapping(value = "/plan", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PlacementPlan> plan(@RequestBody DescriptorDocument document) {
        return ResponseEntity.ok(placementService.plan(descriptorLoader.validate(document)));
    }
}
