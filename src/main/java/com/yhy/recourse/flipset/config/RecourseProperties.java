package com.yhy.recourse.flipset.config;

import com.yhy.recourse.mip.CostType;
import com.yhy.recourse.mip.EnumerationPolicy;
import com.yhy.recourse.mip.MipParameters;
import com.yhy.recourse.mip.solver.BackendType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "recourse.mip")
public class RecourseProperties {

    private BackendType backend = BackendType.OR_TOOLS;

    /**
     * OR-Tools solver id, e.g. SCIP or CBC
     */
    private String solverId = "SCIP";

    private CostType costType = CostType.MAX;

    private EnumerationPolicy enumerationPolicy = EnumerationPolicy.DISTINCT_SUBSETS;

    /**
     * Empty for no limit
     */
    private Duration timeLimit;

    private Long nodeLimit;

    private boolean display = false;

    /**
     * Run the advisory checks on every solution
     */
    private boolean checkFlag = true;

    private long totalItems = 10;

    public MipParameters toMipParameters() {
        return MipParameters.builder()
                .backend(backend)
                .solverId(solverId)
                .costType(costType)
                .enumerationPolicy(enumerationPolicy)
                .timeLimit(timeLimit)
                .nodeLimit(nodeLimit)
                .display(display)
                .checkFlag(checkFlag)
                .totalItems(totalItems)
                .build();
    }
}
