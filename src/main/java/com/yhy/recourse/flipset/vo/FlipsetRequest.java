package com.yhy.recourse.flipset.vo;

import com.yhy.recourse.mip.CostType;
import com.yhy.recourse.mip.EnumerationPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FlipsetRequest {
    @Valid
    @NotEmpty
    private List<FeatureRequest> features;
    @NotEmpty
    private List<Double> coefficients;
    @NotNull
    private Double intercept;
    @NotEmpty
    private List<Double> x;
    private CostType costType;
    @PositiveOrZero
    private Integer minItems;
    @PositiveOrZero
    private Integer maxItems;
    // milliseconds
    @Positive
    private Long timeLimitMs;
    @Positive
    private Long nodeLimit;
    private Boolean display;
    // populate only
    @Positive
    private Long totalItems;
    private EnumerationPolicy policy;
}
