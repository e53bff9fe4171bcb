package com.project.image.enhancement.DTOs;

import org.opencv.core.Mat;

public record UpscaleResult(Mat image, UpscaleMethod method) {}
