package com.project.image.enhancement.DTOs;

import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;

import java.util.Optional;

/**
 * Output of one pipeline run. When no face was found {@code roi} is empty and
 * {@code image} is a copy of the input.
 */
public record EnhancementResult(
        Mat image,
        Optional<Rect> roi,
        UpscaleMethod upscaleMethod,
        Size enhancedRegionSize   // region size before it is resized back into the ROI
) {
    public static EnhancementResult passThrough(Mat original) {
        return new EnhancementResult(original.clone(), Optional.empty(), UpscaleMethod.NONE, new Size());
    }

    public boolean faceFound() {
        return roi.isPresent();
    }
}
