package com.project.image.enhancement.service.superres;

import java.util.Locale;
import java.util.Set;

/**
 * Model families understood by {@link DnnSuperResolutionBackend}.
 */
public enum SuperResolutionAlgorithm {
    EDSR("edsr", Set.of(2, 3, 4)),
    ESPCN("espcn", Set.of(2, 3, 4)),
    FSRCNN("fsrcnn", Set.of(2, 3, 4)),
    LAPSRN("lapsrn", Set.of(2, 4, 8));

    /** Used when the model name matches no known family. */
    public static final SuperResolutionAlgorithm BASELINE = EDSR;

    private final String id;
    private final Set<Integer> supportedScales;

    SuperResolutionAlgorithm(String id, Set<Integer> supportedScales) {
        this.id = id;
        this.supportedScales = supportedScales;
    }

    public String id() {
        return id;
    }

    public boolean supportsScale(int scale) {
        return supportedScales.contains(scale);
    }

    /**
     * Guesses the family from a model path, e.g. {@code EDSR_x4.pb} or {@code LapSRN_x8.pb}.
     */
    public static SuperResolutionAlgorithm inferFrom(String modelName) {
        if (modelName == null) {
            return BASELINE;
        }
        String lower = modelName.toLowerCase(Locale.ROOT);
        for (SuperResolutionAlgorithm algorithm : values()) {
            if (lower.contains(algorithm.id)) {
                return algorithm;
            }
        }
        return BASELINE;
    }
}
