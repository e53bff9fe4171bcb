package com.project.image.enhancement.service.processing;

import com.project.image.enhancement.DTOs.UpscaleMethod;
import com.project.image.enhancement.DTOs.UpscaleResult;
import com.project.image.enhancement.config.OpenCvNatives;
import com.project.image.enhancement.service.superres.SuperResolutionAlgorithm;
import com.project.image.enhancement.service.superres.SuperResolutionBackend;
import com.project.image.enhancement.service.superres.SuperResolutionBackendFactory;
import com.project.image.enhancement.service.superres.SuperResolutionOutcome;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Enlarges the face region before sharpening. A learned backend is tried when a
 * model is configured and the scale is large enough; bicubic interpolation is used
 * otherwise and whenever the backend fails.
 */
@Component
public class Upscaler {
    private static final Logger log = LoggerFactory.getLogger(Upscaler.class);

    public static final double NO_OP_THRESHOLD = 1.01;
    public static final double MIN_SUPER_RES_SCALE = 1.5;

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final SuperResolutionBackendFactory backendFactory;

    public Upscaler(SuperResolutionBackendFactory backendFactory) {
        this.backendFactory = backendFactory;
    }

    public UpscaleResult upscale(Mat region, double scale, String superResModelPath) {
        if (scale <= NO_OP_THRESHOLD) {
            return new UpscaleResult(region.clone(), UpscaleMethod.NONE);
        }

        Size target = targetSize(region, scale);
        boolean backendConfigured = superResModelPath != null && !superResModelPath.isBlank();
        if (!backendConfigured || scale < MIN_SUPER_RES_SCALE) {
            return new UpscaleResult(interpolate(region, target), UpscaleMethod.INTERPOLATION);
        }

        SuperResolutionOutcome outcome = superResolve(region, scale, superResModelPath.trim());
        if (outcome.succeeded()) {
            Mat up = outcome.image();
            if (up.cols() != (int) target.width || up.rows() != (int) target.height) {
                log.debug("Backend produced {}x{}, resizing to {}x{}",
                        up.cols(), up.rows(), (int) target.width, (int) target.height);
                up = interpolate(up, target);
            }
            return new UpscaleResult(up, UpscaleMethod.SUPER_RESOLUTION);
        }

        log.warn("Super-resolution failed: {}. Using bicubic.", outcome.failure().getMessage());
        return new UpscaleResult(interpolate(region, target), UpscaleMethod.INTERPOLATION_FALLBACK);
    }

    /**
     * Single attempt with a fresh backend. Never throws; a failing backend is
     * reported through the returned outcome.
     */
    public SuperResolutionOutcome superResolve(Mat region, double scale, String modelPath) {
        SuperResolutionAlgorithm algorithm = SuperResolutionAlgorithm.inferFrom(modelPath);
        int integerScale = (int) Math.round(scale);
        try {
            Path model = Path.of(modelPath);
            SuperResolutionBackend backend = backendFactory.create();
            backend.readModel(model);
            backend.setModel(algorithm, integerScale);
            Mat up = backend.upsample(region);
            if (up == null || up.empty()) {
                return SuperResolutionOutcome.failure(new IllegalStateException("Backend returned an empty image"));
            }
            log.info("Super-resolution {} x{} applied to {}x{} region", algorithm, integerScale, region.cols(), region.rows());
            return SuperResolutionOutcome.success(up);
        } catch (RuntimeException e) {
            log.debug("Backend {} x{} failed on {}", algorithm, integerScale, modelPath, e);
            return SuperResolutionOutcome.failure(e);
        }
    }

    static Size targetSize(Mat region, double scale) {
        return new Size(Math.round(region.cols() * scale), Math.round(region.rows() * scale));
    }

    private static Mat interpolate(Mat region, Size target) {
        Mat up = new Mat();
        Imgproc.resize(region, up, target, 0, 0, Imgproc.INTER_CUBIC);
        return up;
    }
}
