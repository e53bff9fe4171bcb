package com.project.image.enhancement.DTOs;

/**
 * Per-run options. A blank {@code superResModelPath} disables the super-resolution backend;
 * {@code superResScale} is still used for plain interpolation when it exceeds 1.01.
 */
public record PipelineConfig(double sharpenAmount, String superResModelPath, double superResScale) {

    public static final double DEFAULT_SHARPEN_AMOUNT = 1.0;
    public static final double DEFAULT_SUPER_RES_SCALE = 2.0;

    public PipelineConfig {
        if (!Double.isFinite(sharpenAmount) || sharpenAmount < 0) {
            throw new IllegalArgumentException("Sharpen amount must be a non-negative number: " + sharpenAmount);
        }
        if (!Double.isFinite(superResScale) || superResScale <= 0) {
            throw new IllegalArgumentException("Scale must be a positive number: " + superResScale);
        }
        superResModelPath = superResModelPath == null ? "" : superResModelPath.trim();
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(DEFAULT_SHARPEN_AMOUNT, "", DEFAULT_SUPER_RES_SCALE);
    }

    public boolean superResolutionConfigured() {
        return !superResModelPath.isEmpty();
    }
}
