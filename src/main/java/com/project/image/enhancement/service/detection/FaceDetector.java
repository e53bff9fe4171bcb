package com.project.image.enhancement.service.detection;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.List;

/**
 * Face candidates in a grayscale, histogram-equalized image. The list may be empty.
 */
@FunctionalInterface
public interface FaceDetector {

    List<Rect> detect(Mat grayEqualized);
}
