package com.di.fragnova.descriptor;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One node record. Accepts the older {@code hbm_budget}/{@code tlb_budget}/{@code pred_interference}
 * keys as aliases. Numeric ids are read as strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeDescriptor {
    private String id;

    @JsonProperty("capacity_budget")
    @JsonAlias({"hbm_budget", "capacityBudget"})
    private Long capacityBudget;

    @JsonProperty("unit_budget")
    @JsonAlias({"tlb_budget", "unitBudget"})
    private Long unitBudget;

    @JsonProperty("predicted_interference")
    @JsonAlias({"pred_interference", "predictedInterference"})
    private Double predictedInterference;
}
