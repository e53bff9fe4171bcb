package com.project.image.enhancement.service;

import com.project.image.enhancement.DTOs.EnhancementResult;
import com.project.image.enhancement.DTOs.PipelineConfig;
import com.project.image.enhancement.DTOs.UpscaleResult;
import com.project.image.enhancement.config.OpenCvNatives;
import com.project.image.enhancement.exceptions.EnhancementException;
import com.project.image.enhancement.service.detection.FaceDetectionService;
import com.project.image.enhancement.service.detection.FaceDetector;
import com.project.image.enhancement.service.processing.ContrastEqualizer;
import com.project.image.enhancement.service.processing.Denoiser;
import com.project.image.enhancement.service.processing.FeatherCompositor;
import com.project.image.enhancement.service.processing.RegionSelector;
import com.project.image.enhancement.service.processing.Sharpener;
import com.project.image.enhancement.service.processing.Upscaler;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Detect, select, crop, upscale, sharpen, equalize, denoise and composite back.
 * Either the enhanced image or an untouched copy of the input comes out; the
 * input {@code Mat} itself is never modified.
 */
@Service
public class EnhancementPipeline {
    private static final Logger log = LoggerFactory.getLogger(EnhancementPipeline.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final RegionSelector regionSelector;
    private final Upscaler upscaler;
    private final Sharpener sharpener;
    private final ContrastEqualizer contrastEqualizer;
    private final Denoiser denoiser;
    private final FeatherCompositor compositor;
    private final StorageService storageService;
    private final FaceDetectionService faceDetectionService;

    public EnhancementPipeline(RegionSelector regionSelector, Upscaler upscaler, Sharpener sharpener,
                               ContrastEqualizer contrastEqualizer, Denoiser denoiser, FeatherCompositor compositor,
                               StorageService storageService, FaceDetectionService faceDetectionService) {
        this.regionSelector = regionSelector;
        this.upscaler = upscaler;
        this.sharpener = sharpener;
        this.contrastEqualizer = contrastEqualizer;
        this.denoiser = denoiser;
        this.compositor = compositor;
        this.storageService = storageService;
        this.faceDetectionService = faceDetectionService;
    }

    public EnhancementResult enhance(Mat image, FaceDetector detector, PipelineConfig config) {
        if (image == null || image.empty()) {
            throw new EnhancementException("Image is empty.");
        }
        if (image.channels() != 3) {
            throw new EnhancementException("Expected a 3-channel BGR image, got " + image.channels() + " channel(s).");
        }
        log.info("Starting enhancement for image {}x{}, sharpen={}, scale={}, superRes={}",
                image.cols(), image.rows(), config.sharpenAmount(), config.superResScale(),
                config.superResolutionConfigured() ? config.superResModelPath() : "off");

        List<Rect> candidates = detector.detect(prepareForDetection(image));
        Optional<Rect> face = regionSelector.selectLargest(candidates);
        if (face.isEmpty()) {
            log.warn("No face detected. Passing the original image through.");
            return EnhancementResult.passThrough(image);
        }

        Rect roi = regionSelector.expandAndClip(face.get(), image.size());
        log.info("Face {} selected, processing region {}", face.get(), roi);

        Mat region = image.submat(roi).clone();

        UpscaleResult upscaled = upscaler.upscale(region, config.superResScale(), config.superResModelPath());
        log.debug("Upscale: {} -> {}x{}", upscaled.method(), upscaled.image().cols(), upscaled.image().rows());

        Mat enhanced = sharpener.sharpen(upscaled.image(), config.sharpenAmount());
        enhanced = contrastEqualizer.enhanceLocalContrast(enhanced);
        enhanced = denoiser.denoise(enhanced);

        Mat result = image.clone();
        compositor.pasteWithFeather(enhanced, roi, result);

        log.info("Enhancement completed, region {} ({})", roi, upscaled.method());
        return new EnhancementResult(result, Optional.of(roi), upscaled.method(), enhanced.size());
    }

    /**
     * File to file run. Unreadable input, an unloadable cascade and an unwritable output
     * are propagated; nothing is written unless the run got that far.
     */
    public EnhancementResult enhanceFile(Path input, Path output, Path cascade, PipelineConfig config) {
        Mat image = storageService.load(input);
        FaceDetector detector = faceDetectionService.load(cascade);
        EnhancementResult result = enhance(image, detector, config);
        storageService.save(result.image(), output);
        return result;
    }

    // The detector works on gray, globally equalized input for robustness to lighting.
    static Mat prepareForDetection(Mat image) {
        Mat gray = new Mat();
        Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        Imgproc.equalizeHist(gray, gray);
        return gray;
    }
}
