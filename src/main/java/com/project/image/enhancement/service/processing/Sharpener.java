package com.project.image.enhancement.service.processing;

import com.project.image.enhancement.config.OpenCvNatives;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Unsharp masking: {@code out = in * (1 + amount) - blurred * amount}, saturated to the 8-bit range.
 */
@Component
public class Sharpener {
    private static final Logger log = LoggerFactory.getLogger(Sharpener.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    public Mat sharpen(Mat region, double amount) {
        if (amount <= 0.0) {
            return region.clone();
        }

        int k = KernelMath.sharpenKernelSize(amount);
        Mat kernel = toKernelMat(KernelMath.gaussianKernel(k, 0));
        log.debug("Sharpening {}x{} region, amount={}, kernel={}", region.cols(), region.rows(), amount, k);

        Mat blurred = new Mat();
        Imgproc.sepFilter2D(region, blurred, -1, kernel, kernel);

        Mat sharp = new Mat();
        Core.addWeighted(region, 1.0 + amount, blurred, -amount, 0, sharp);
        return sharp;
    }

    static Mat toKernelMat(double[] taps) {
        Mat kernel = new Mat(taps.length, 1, CvType.CV_64F);
        kernel.put(0, 0, taps);
        return kernel;
    }
}
