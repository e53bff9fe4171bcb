package com.project.image.enhancement.service.superres;

import org.opencv.core.Mat;

/**
 * Result of a single backend call: either the upsampled image or the failure that prevented it.
 */
public record SuperResolutionOutcome(Mat image, RuntimeException failure) {

    public static SuperResolutionOutcome success(Mat image) {
        return new SuperResolutionOutcome(image, null);
    }

    public static SuperResolutionOutcome failure(RuntimeException failure) {
        return new SuperResolutionOutcome(null, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
