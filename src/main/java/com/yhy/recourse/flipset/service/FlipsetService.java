package com.yhy.recourse.flipset.service;

import com.google.ortools.Loader;
import com.yhy.recourse.flipset.vo.FeatureRequest;
import com.yhy.recourse.flipset.vo.FlipsetRequest;
import com.yhy.recourse.mip.ClassifierModel;
import com.yhy.recourse.mip.GridActionSet;
import com.yhy.recourse.mip.MipParameters;
import com.yhy.recourse.mip.RecourseBuilder;
import com.yhy.recourse.mip.SolutionRecord;
import com.yhy.recourse.mip.SolveOptions;
import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import com.yhy.recourse.mip.solver.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs recourse requests. Every call configures its own {@link RecourseBuilder},
 * so concurrent requests never share a MIP.
 */
@Service
public class FlipsetService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlipsetService.class);

    private final MipParameters parameters;

    public FlipsetService(MipParameters parameters) {
        this.parameters = parameters;
    }

    public SolutionRecord fit(FlipsetRequest request) {
        RecourseBuilder builder = configure(request);
        return builder.solveOnce(solveOptions(request));
    }

    public List<SolutionRecord> populate(FlipsetRequest request) {
        if (request.getTotalItems() == null) {
            throw new RecourseConfigurationException("totalItems is required for populate");
        }
        RecourseBuilder builder = configure(request);
        List<SolutionRecord> items = builder.enumerate(request.getTotalItems(), request.getPolicy(), solveOptions(request))
                .collect(Collectors.toList());
        LOGGER.info("Flipset of {} items for {} features", items.size(), request.getFeatures().size());
        return items;
    }

    private RecourseBuilder configure(FlipsetRequest request) {
        List<GridActionSet.Feature> features = request.getFeatures().stream()
                .map(FlipsetService::toFeature)
                .collect(Collectors.toList());
        ClassifierModel classifier = new ClassifierModel(toArray(request.getCoefficients()), request.getIntercept());
        return RecourseBuilder.configure(new GridActionSet(features), classifier, toArray(request.getX()),
                request.getCostType(), request.getMinItems(), request.getMaxItems(), parameters);
    }

    private SolveOptions solveOptions(FlipsetRequest request) {
        SolveOptions defaults = parameters.defaultSolveOptions();
        return SolveOptions.builder()
                .timeLimit(request.getTimeLimitMs() == null ? defaults.getTimeLimit() : Duration.ofMillis(request.getTimeLimitMs()))
                .nodeLimit(request.getNodeLimit() == null ? defaults.getNodeLimit() : request.getNodeLimit())
                .display(request.getDisplay() == null ? defaults.isDisplay() : request.getDisplay())
                .build();
    }

    private static GridActionSet.Feature toFeature(FeatureRequest f) {
        return GridActionSet.Feature.builder()
                .name(f.getName())
                .actionable(f.isActionable())
                .grid(f.getGrid() == null ? null : toArray(f.getGrid()))
                .percentiles(f.getPercentiles() == null ? null : toArray(f.getPercentiles()))
                .build();
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new RecourseConfigurationException("null value at position " + i);
            }
            out[i] = v;
        }
        return out;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void init() {
        if (parameters.getBackend() == BackendType.OR_TOOLS) {
            Loader.loadNativeLibraries();
        }
    }
}
