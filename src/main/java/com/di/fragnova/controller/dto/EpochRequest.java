package com.di.fragnova.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Access events observed during one epoch. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EpochRequest {

    @NotNull
    private List<String> accessed = new ArrayList<>();
}
