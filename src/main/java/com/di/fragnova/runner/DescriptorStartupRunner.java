package com.di.fragnova.runner;

import com.di.fragnova.descriptor.DescriptorLoader;
import com.di.fragnova.descriptor.DescriptorProperties;
import com.di.fragnova.model.PlacementDescriptor;
import com.di.fragnova.placement.PlacementPlan;
import com.di.fragnova.service.PlacementService;
import com.di.fragnova.service.ResidencyInitialization;
import com.di.fragnova.service.ResidencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads {@code fragnova.descriptor.path} at startup, plans it and (unless disabled) seeds the residency
 * controller. A malformed descriptor fails startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DescriptorStartupRunner implements ApplicationRunner {

    private final DescriptorProperties descriptorProperties;
    private final DescriptorLoader descriptorLoader;
    private final PlacementService placementService;
    private final ResidencyService residencyService;

    @Override
    public void run(ApplicationArguments args) {
        if (!descriptorProperties.hasPath()) {
            log.info("[STARTUP] No fragnova.descriptor.path set; waiting for API calls");
            return;
        }
        PlacementDescriptor descriptor = descriptorLoader.load(descriptorProperties.getPath());
        PlacementPlan plan;
        if (descriptorProperties.isInitializeResidency()) {
            ResidencyInitialization init = residencyService.initialize(descriptor);
            plan = init.plan();
            if (!init.untracked().isEmpty()) {
                log.warn("[STARTUP] {} fragment(s) fit no node and are not tracked: {}", init.untracked().size(), init.untracked());
            }
        } else {
            plan = placementService.plan(descriptor);
        }
        log.info("[STARTUP] Plan: {} placed, unplaced={}", plan.assignments().size(), plan.unplacedIds());
    }
}
