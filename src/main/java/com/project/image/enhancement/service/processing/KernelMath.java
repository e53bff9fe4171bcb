package com.project.image.enhancement.service.processing;

/**
 * Numeric helpers shared by the sharpening and compositing stages:
 * separable Gaussian kernels and the feathered weight field used for blending.
 * No state, no OpenCV dependency.
 */
public final class KernelMath {

    public static final int MIN_FEATHER_RADIUS = 3;
    public static final int FEATHER_RADIUS_DIVISOR = 20;

    // Binomial tables used for small kernels when no sigma is given
    private static final double[][] SMALL_GAUSSIAN_TAB = {
            {1.0},
            {0.25, 0.5, 0.25},
            {0.0625, 0.25, 0.375, 0.25, 0.0625},
            {0.03125, 0.109375, 0.21875, 0.28125, 0.21875, 0.109375, 0.03125}
    };

    private KernelMath() {
    }

    /**
     * One-dimensional Gaussian kernel normalized to sum 1.
     *
     * @param size  odd number of taps
     * @param sigma standard deviation; a value {@code <= 0} derives it from the size
     */
    public static double[] gaussianKernel(int size, double sigma) {
        if (size <= 0 || size % 2 == 0) {
            throw new IllegalArgumentException("Kernel size must be odd and positive: " + size);
        }
        if (sigma <= 0 && size <= 7) {
            return SMALL_GAUSSIAN_TAB[size / 2].clone();
        }

        double s = sigma > 0 ? sigma : 0.3 * ((size - 1) * 0.5 - 1) + 0.8;
        double scale2X = -0.5 / (s * s);
        double[] kernel = new double[size];
        double sum = 0;
        for (int i = 0; i < size; i++) {
            double x = i - (size - 1) * 0.5;
            kernel[i] = Math.exp(scale2X * x * x);
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    /** Blur window for unsharp masking: stronger sharpening uses a coarser blur. */
    public static int sharpenKernelSize(double amount) {
        if (amount < 0.75) return 3;
        if (amount < 1.5) return 5;
        if (amount < 2.5) return 7;
        return 9;
    }

    public static int featherRadius(int roiWidth) {
        return Math.max(MIN_FEATHER_RADIUS, roiWidth / FEATHER_RADIUS_DIVISOR);
    }

    /**
     * Row-major weight field of the given size: a field of ones blurred with a
     * {@code 2*radius+1} tap Gaussian (sigma = radius) where samples outside the
     * field count as zero, then rescaled so the minimum is 0 and the maximum is 1.
     */
    public static float[] featherWeights(int width, int height, int radius) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Feather field must have a positive size: " + width + "x" + height);
        }
        int r = Math.max(1, radius);
        double[] kernel = gaussianKernel(2 * r + 1, r);

        // the field is separable: ones(w) x ones(h)
        double[] px = coverageProfile(width, kernel, r);
        double[] py = coverageProfile(height, kernel, r);

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double vy : py) {
            for (double vx : px) {
                double v = vy * vx;
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }

        float[] weights = new float[width * height];
        double range = max - min;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double v = py[y] * px[x];
                weights[y * width + x] = range > 0 ? (float) ((v - min) / range) : 1f;
            }
        }
        return weights;
    }

    // Sum of the kernel taps that land inside [0, length) for every position.
    private static double[] coverageProfile(int length, double[] kernel, int r) {
        double[] profile = new double[length];
        for (int i = 0; i < length; i++) {
            double acc = 0;
            for (int k = -r; k <= r; k++) {
                int j = i + k;
                if (j >= 0 && j < length) {
                    acc += kernel[k + r];
                }
            }
            profile[i] = acc;
        }
        return profile;
    }
}
