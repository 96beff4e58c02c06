package com.di.fragnova.descriptor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One fragment record as it appears in a descriptor file or request body. Validated into a
 * {@link com.di.fragnova.model.Fragment} by {@link DescriptorLoader}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FragmentDescriptor {
    private String id;
    private Long size;
    private Double importance;
    private Long reuse;
    private String timescale;
}
