package com.project.image.enhancement.service.superres;

import org.opencv.core.Mat;

import java.nio.file.Path;

/**
 * Learned upscaler. Instances are stateful (model, algorithm, scale) and are
 * created fresh for every upscale call. All methods signal failure with an
 * unchecked exception.
 */
public interface SuperResolutionBackend {

    void readModel(Path modelPath);

    void setModel(SuperResolutionAlgorithm algorithm, int scale);

    Mat upsample(Mat image);
}
