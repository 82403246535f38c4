package com.yhy.recourse.flipset.vo;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One feature of the action set. {@code grid} and {@code percentiles} are only read for actionable features.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FeatureRequest {
    @NotBlank
    private String name;
    private boolean actionable;
    private List<Double> grid;
    private List<Double> percentiles;
}
