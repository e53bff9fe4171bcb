package com.project.image.enhancement.service.superres;

import com.project.image.enhancement.config.OpenCvNatives;
import com.project.image.enhancement.exceptions.SuperResolutionException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.dnn.Dnn;
import org.opencv.dnn.Net;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs pretrained super-resolution networks (TensorFlow {@code .pb} graphs) through the OpenCV DNN module.
 * EDSR works on mean-subtracted BGR; the other families only see the luma channel and the chroma
 * channels are upscaled bicubically.
 */
public class DnnSuperResolutionBackend implements SuperResolutionBackend {
    private static final Logger log = LoggerFactory.getLogger(DnnSuperResolutionBackend.class);

    // BGR mean of the DIV2K training set
    private static final Scalar EDSR_MEAN = new Scalar(103.1545782, 111.561547, 114.35629928);

    static {
        OpenCvNatives.ensureLoaded();
    }

    private Net net;
    private SuperResolutionAlgorithm algorithm;
    private int scale;

    @Override
    public void readModel(Path modelPath) {
        if (!Files.isRegularFile(modelPath)) {
            throw new SuperResolutionException("Model file not found: " + modelPath);
        }
        String name = modelPath.toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".pb")) {
            throw new SuperResolutionException("Unsupported model format (expected .pb): " + modelPath);
        }
        Net loaded;
        try {
            loaded = Dnn.readNetFromTensorflow(modelPath.toString());
        } catch (RuntimeException e) {
            throw new SuperResolutionException("Model could not be read: " + modelPath, e);
        }
        if (loaded.empty()) {
            throw new SuperResolutionException("Model could not be read: " + modelPath);
        }
        this.net = loaded;
        log.debug("Loaded super-resolution model {}", modelPath);
    }

    @Override
    public void setModel(SuperResolutionAlgorithm algorithm, int scale) {
        if (!algorithm.supportsScale(scale)) {
            throw new SuperResolutionException("Scale x" + scale + " is not supported by " + algorithm);
        }
        this.algorithm = algorithm;
        this.scale = scale;
    }

    @Override
    public Mat upsample(Mat image) {
        if (image == null || image.channels() != 3) {
            throw new SuperResolutionException("Expected a 3-channel BGR image");
        }
        if (net == null) {
            throw new SuperResolutionException("No model loaded");
        }
        if (algorithm == null) {
            throw new SuperResolutionException("Algorithm and scale not set");
        }
        return algorithm == SuperResolutionAlgorithm.EDSR ? upsampleBgr(image) : upsampleLuma(image);
    }

    private Mat upsampleBgr(Mat image) {
        Mat floatImg = new Mat();
        image.convertTo(floatImg, CvType.CV_32F, 1.0);

        Mat blob = Dnn.blobFromImage(floatImg, 1.0, new Size(), EDSR_MEAN, false, false);
        Mat output = forward(blob);

        Mat withMean = new Mat();
        Core.add(output, EDSR_MEAN, withMean);
        Mat result = new Mat();
        withMean.convertTo(result, CvType.CV_8U);
        return result;
    }

    private Mat upsampleLuma(Mat image) {
        Mat ycrcb = new Mat();
        Imgproc.cvtColor(image, ycrcb, Imgproc.COLOR_BGR2YCrCb);
        Mat preprocessed = new Mat();
        ycrcb.convertTo(preprocessed, CvType.CV_32F, 1.0 / 255.0);

        List<Mat> channels = new ArrayList<>();
        Core.split(preprocessed, channels);
        Mat blob = Dnn.blobFromImage(channels.get(0), 1.0);
        Mat upscaledLuma = forward(blob);

        // chroma is upscaled conventionally and merged with the predicted luma
        Mat resized = new Mat();
        Imgproc.resize(preprocessed, resized, upscaledLuma.size(), 0, 0, Imgproc.INTER_CUBIC);
        List<Mat> merged = new ArrayList<>();
        Core.split(resized, merged);
        merged.set(0, upscaledLuma);
        Mat mergedImg = new Mat();
        Core.merge(merged, mergedImg);

        Mat bytes = new Mat();
        mergedImg.convertTo(bytes, CvType.CV_8U, 255.0);
        Mat result = new Mat();
        Imgproc.cvtColor(bytes, result, Imgproc.COLOR_YCrCb2BGR);
        return result;
    }

    private Mat forward(Mat blob) {
        net.setInput(blob);
        Mat out = net.forward();
        List<Mat> images = new ArrayList<>();
        Dnn.imagesFromBlob(out, images);
        if (images.isEmpty()) {
            throw new SuperResolutionException(algorithm + " produced no output");
        }
        log.debug("{} x{} produced {}x{}", algorithm, scale, images.get(0).cols(), images.get(0).rows());
        return images.get(0);
    }
}
