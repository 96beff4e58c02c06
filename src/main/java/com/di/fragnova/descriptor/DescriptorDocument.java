package com.di.fragnova.descriptor;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a descriptor file:
 * <pre>
 * fragments:
 *   - { id: f0001, size: 4096, importance: 0.9, reuse: 3, timescale: short }
 * nodes:
 *   - { id: "0", capacity_budget: 8589934592, unit_budget: 262144 }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DescriptorDocument {
    private List<FragmentDescriptor> fragments = new ArrayList<>();
    private List<NodeDescriptor> nodes = new ArrayList<>();
}
