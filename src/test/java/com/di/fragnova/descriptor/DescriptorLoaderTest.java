package com.di.fragnova.descriptor;

import com.di.fragnova.exception.MalformedDescriptorException;
import com.di.fragnova.model.Node;
import com.di.fragnova.model.PlacementDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DescriptorLoader Tests")
class DescriptorLoaderTest {

    private final DescriptorLoader loader = new DescriptorLoader(new DefaultResourceLoader());

    @Test
    @DisplayName("Loads JSON with legacy budget keys and numeric node ids")
    void loadsJsonWithAliases() {
        PlacementDescriptor descriptor = loader.load("classpath:descriptors/two-nodes.json");

        assertEquals(2, descriptor.fragments().size());
        assertEquals("a", descriptor.fragments().get(0).getId());
        assertEquals(10, descriptor.fragments().get(0).getReuse());

        Node n0 = descriptor.nodes().get(0);
        assertEquals("0", n0.getId());
        assertEquals(5000, n0.getCapacityBudget());
        assertFalse(n0.hasUnitBudget());
        assertEquals(0.0, n0.getPredictedInterference());

        Node n1 = descriptor.nodes().get(1);
        assertEquals(4L, n1.getUnitBudget());
        assertEquals(0.5, n1.getPredictedInterference());
    }

    @Test
    @DisplayName("Loads YAML with legacy budget keys")
    void loadsYaml() {
        PlacementDescriptor descriptor = loader.load("classpath:descriptors/sample.yml");

        assertEquals(List.of("f1", "f2"), descriptor.fragments().stream().map(f -> f.getId()).toList());
        assertEquals(0.3, descriptor.fragments().get(1).getImportance());
        assertEquals(1, descriptor.fragments().get(1).getReuse());
        assertEquals(50_000, descriptor.nodes().get(1).getCapacityBudget());
        assertEquals(16L, descriptor.nodes().get(1).getUnitBudget());
    }

    @Test
    @DisplayName("Reports every invalid record at once")
    void collectsAllProblems() {
        MalformedDescriptorException e = assertThrows(MalformedDescriptorException.class,
                () -> loader.load("classpath:descriptors/malformed.yml"));

        List<String> problems = e.getProblems();
        assertEquals(5, problems.size(), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("fragments[0]") && p.contains("size")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("duplicate fragment id a")));
        assertTrue(problems.stream().anyMatch(p -> p.contains("reuse")));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("nodes[0]") && p.contains("capacity_budget")));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("nodes[1]") && p.contains("predicted_interference")));
    }

    @Test
    @DisplayName("Missing file is a malformed descriptor")
    void missingFile() {
        assertThrows(MalformedDescriptorException.class, () -> loader.load("classpath:descriptors/nope.json"));
    }

    @Test
    @DisplayName("Unparseable content is a malformed descriptor")
    void unparseable() {
        byte[] garbage = "{ fragments: [".getBytes(StandardCharsets.UTF_8);
        assertThrows(MalformedDescriptorException.class, () -> loader.parse(new ByteArrayInputStream(garbage), true));
    }

    @Test
    @DisplayName("Fragments without importance or reuse are rejected")
    void importanceAndReuseRequired() {
        byte[] yaml = ("fragments:\n"
                + "  - { id: f1, size: 4096 }\n"
                + "nodes:\n"
                + "  - { id: n, capacity_budget: 10000 }\n").getBytes(StandardCharsets.UTF_8);

        MalformedDescriptorException e = assertThrows(MalformedDescriptorException.class,
                () -> loader.parse(new ByteArrayInputStream(yaml), false));

        assertEquals(List.of("fragments[0]: importance is required", "fragments[0]: reuse is required"), e.getProblems());
    }

    @Test
    @DisplayName("Empty lists are valid")
    void emptyDocument() {
        PlacementDescriptor descriptor = loader.validate(new DescriptorDocument());
        assertTrue(descriptor.fragments().isEmpty());
        assertTrue(descriptor.nodes().isEmpty());
    }

    @Test
    @DisplayName("Non-finite importance is rejected")
    void nonFiniteImportance() {
        DescriptorDocument document = new DescriptorDocument(
                List.of(FragmentDescriptor.builder().id("x").size(1L).importance(Double.NaN).reuse(0L).build()),
                List.of(NodeDescriptor.builder().id("n").capacityBudget(10L).build()));
        MalformedDescriptorException e = assertThrows(MalformedDescriptorException.class, () -> loader.validate(document));
        assertTrue(e.getProblems().get(0).contains("importance"));
    }
}
