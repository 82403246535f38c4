package com.yhy.recourse.mip.solver;

import com.yhy.recourse.mip.MipParameters;

/**
 * Creates a fresh backend handle from explicit configuration. Every MIP build
 * gets its own handle; handles are never shared between builders.
 */
public final class MipBackendFactory {

    private MipBackendFactory() {
    }

    public static MipBackend create(MipParameters parameters) {
        switch (parameters.getBackend()) {
            case OJALGO:
                return new OjAlgoMipBackend();
            case OR_TOOLS:
            default:
                return new OrToolsMipBackend(parameters.getSolverId());
        }
    }
}
