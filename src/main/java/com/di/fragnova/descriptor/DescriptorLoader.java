package com.di.fragnova.descriptor;

import com.di.fragnova.exception.MalformedDescriptorException;
import com.di.fragnova.model.Fragment;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.PlacementDescriptor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a fragment/node descriptor (JSON or YAML) and validates it into a {@link PlacementDescriptor}.
 * <p>
 * Validation collects every problem before failing, so one {@link MalformedDescriptorException}
 * lists all bad records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DescriptorLoader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;

    /**
     * Loads from a Spring resource location. {@code .json} files use the JSON parser, everything else YAML.
     */
    public PlacementDescriptor load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Descriptor location is required");
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new MalformedDescriptorException(List.of("descriptor not found: " + location));
        }
        try (InputStream in = resource.getInputStream()) {
            PlacementDescriptor descriptor = parse(in, isJson(location));
            log.info("[DESCRIPTOR] Loaded {} fragment(s), {} node(s) from {}",
                    descriptor.fragments().size(), descriptor.nodes().size(), location);
            return descriptor;
        } catch (IOException e) {
            throw new MalformedDescriptorException("unreadable descriptor " + location + ": " + e.getMessage(), e);
        }
    }

    public PlacementDescriptor parse(InputStream in, boolean json) {
        DescriptorDocument document;
        try {
            document = (json ? JSON_MAPPER : YAML_MAPPER).readValue(in, DescriptorDocument.class);
        } catch (IOException e) {
            throw new MalformedDescriptorException("unparseable descriptor: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new MalformedDescriptorException(List.of("descriptor is empty"));
        }
        return validate(document);
    }

    /**
     * Converts an already-deserialized document (e.g. a REST body), failing on the first pass with all problems.
     */
    public PlacementDescriptor validate(DescriptorDocument document) {
        List<String> problems = new ArrayList<>();
        List<Fragment> fragments = new ArrayList<>();
        List<Node> nodes = new ArrayList<>();

        Set<String> fragmentIds = new HashSet<>();
        List<FragmentDescriptor> rawFragments = document.getFragments() == null ? List.of() : document.getFragments();
        for (int i = 0; i < rawFragments.size(); i++) {
            FragmentDescriptor f = rawFragments.get(i);
            String where = "fragments[" + i + "]";
            if (f == null) {
                problems.add(where + ": null record");
                continue;
            }
            int before = problems.size();
            if (f.getId() == null || f.getId().isBlank()) {
                problems.add(where + ": id is required");
            } else if (!fragmentIds.add(f.getId())) {
                problems.add(where + ": duplicate fragment id " + f.getId());
            }
            if (f.getSize() == null || f.getSize() <= 0) {
                problems.add(where + ": size must be > 0, got " + f.getSize());
            }
            if (f.getImportance() == null) {
                problems.add(where + ": importance is required");
            } else if (!Double.isFinite(f.getImportance())) {
                problems.add(where + ": importance must be finite, got " + f.getImportance());
            }
            if (f.getReuse() == null) {
                problems.add(where + ": reuse is required");
            } else if (f.getReuse() < 0) {
                problems.add(where + ": reuse must be >= 0, got " + f.getReuse());
            }
            if (problems.size() == before) {
                fragments.add(Fragment.builder()
                        .id(f.getId())
                        .size(f.getSize())
                        .importance(f.getImportance())
                        .reuse(f.getReuse())
                        .timescale(f.getTimescale())
                        .build());
            }
        }

        Set<String> nodeIds = new HashSet<>();
        List<NodeDescriptor> rawNodes = document.getNodes() == null ? List.of() : document.getNodes();
        for (int i = 0; i < rawNodes.size(); i++) {
            NodeDescriptor n = rawNodes.get(i);
            String where = "nodes[" + i + "]";
            if (n == null) {
                problems.add(where + ": null record");
                continue;
            }
            int before = problems.size();
            if (n.getId() == null || n.getId().isBlank()) {
                problems.add(where + ": id is required");
            } else if (!nodeIds.add(n.getId())) {
                problems.add(where + ": duplicate node id " + n.getId());
            }
            if (n.getCapacityBudget() == null || n.getCapacityBudget() <= 0) {
                problems.add(where + ": capacity_budget must be > 0, got " + n.getCapacityBudget());
            }
            if (n.getUnitBudget() != null && n.getUnitBudget() <= 0) {
                problems.add(where + ": unit_budget must be > 0 when present, got " + n.getUnitBudget());
            }
            Double interference = n.getPredictedInterference();
            if (interference != null && (interference < 0 || !Double.isFinite(interference))) {
                problems.add(where + ": predicted_interference must be a finite value >= 0, got " + interference);
            }
            if (problems.size() == before) {
                nodes.add(Node.builder()
                        .id(n.getId())
                        .capacityBudget(n.getCapacityBudget())
                        .unitBudget(n.getUnitBudget())
                        .predictedInterference(interference == null ? 0.0 : interference)
                        .build());
            }
        }

        if (!problems.isEmpty()) {
            log.warn("[DESCRIPTOR] Rejected descriptor with {} problem(s)", problems.size());
            throw new MalformedDescriptorException(problems);
        }
        return new PlacementDescriptor(fragments, nodes);
    }

    private static boolean isJson(String location) {
        return location.trim().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
