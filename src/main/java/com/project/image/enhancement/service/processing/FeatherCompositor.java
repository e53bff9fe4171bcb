package com.project.image.enhancement.service.processing;

import com.project.image.enhancement.config.OpenCvNatives;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Puts the processed face back into the photo. The blend weight is 1 in the middle of
 * the region and falls off toward its border, so there is no visible rectangular seam.
 */
@Component
public class FeatherCompositor {
    private static final Logger log = LoggerFactory.getLogger(FeatherCompositor.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    /** Single channel {@code CV_32F} mask in [0, 1] with its maximum at exactly 1. */
    public Mat buildFeatherMask(Size size, int radius) {
        int w = (int) size.width;
        int h = (int) size.height;
        float[] weights = KernelMath.featherWeights(w, h, radius);
        Mat mask = new Mat(h, w, CvType.CV_32FC1);
        mask.put(0, 0, weights);
        return mask;
    }

    public int featherRadius(int roiWidth) {
        return KernelMath.featherRadius(roiWidth);
    }

    /**
     * Blends {@code processed} into {@code canvas} at {@code roi}:
     * {@code canvas = processed * mask + canvas * (1 - mask)}. The canvas is modified in place.
     */
    public void pasteWithFeather(Mat processed, Rect roi, Mat canvas) {
        if (roi.x < 0 || roi.y < 0 || roi.width <= 0 || roi.height <= 0
                || roi.x + roi.width > canvas.cols() || roi.y + roi.height > canvas.rows()) {
            throw new IllegalArgumentException("ROI " + roi + " is outside the " + canvas.cols() + "x" + canvas.rows() + " canvas");
        }
        if (processed.channels() != canvas.channels()) {
            throw new IllegalArgumentException("Channel mismatch: " + processed.channels() + " vs " + canvas.channels());
        }

        Mat dstRoi = canvas.submat(roi);

        Mat resized;
        if (processed.cols() == roi.width && processed.rows() == roi.height) {
            resized = processed;
        } else {
            resized = new Mat();
            Imgproc.resize(processed, resized, roi.size(), 0, 0, Imgproc.INTER_CUBIC);
        }

        int radius = featherRadius(roi.width);
        Mat mask = buildFeatherMask(roi.size(), radius);
        Mat maskN = mask;
        if (canvas.channels() > 1) {
            List<Mat> planes = new ArrayList<>(Collections.nCopies(canvas.channels(), mask));
            maskN = new Mat();
            Core.merge(planes, maskN);
        }

        Mat dstF = new Mat();
        Mat srcF = new Mat();
        dstRoi.convertTo(dstF, CvType.CV_32F, 1.0 / 255.0);
        resized.convertTo(srcF, CvType.CV_32F, 1.0 / 255.0);

        Mat inverse = new Mat();
        Core.subtract(new Mat(maskN.size(), maskN.type(), Scalar.all(1.0)), maskN, inverse);

        Mat blended = new Mat();
        Core.add(srcF.mul(maskN), dstF.mul(inverse), blended);
        blended.convertTo(dstRoi, canvas.type(), 255.0);

        log.debug("Composited {}x{} region at ({}, {}) with feather radius {}", roi.width, roi.height, roi.x, roi.y, radius);
    }
}
