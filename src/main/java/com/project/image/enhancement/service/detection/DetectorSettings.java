package com.project.image.enhancement.service.detection;

import org.opencv.core.Size;

public record DetectorSettings(double scaleFactor, int minNeighbors, int minSize) {

    public DetectorSettings {
        if (scaleFactor <= 1.0) {
            throw new IllegalArgumentException("Scale factor must be greater than 1: " + scaleFactor);
        }
        if (minNeighbors < 0 || minSize < 0) {
            throw new IllegalArgumentException("Detector limits must not be negative");
        }
    }

    public Size minSizeAsSize() {
        return new Size(minSize, minSize);
    }
}
