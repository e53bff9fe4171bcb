package com.project.image.enhancement.controller;

import com.project.image.enhancement.DTOs.EnhancementResult;
import com.project.image.enhancement.DTOs.PipelineConfig;
import com.project.image.enhancement.service.EnhancementPipeline;
import com.project.image.enhancement.service.StorageService;
import com.project.image.enhancement.service.detection.FaceDetectionService;
import com.project.image.enhancement.service.detection.FaceDetector;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

@RestController
@Validated
public class EnhancementController {
    private static final Logger log = LoggerFactory.getLogger(EnhancementController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/bmp", "image/webp", "image/tiff"
    );

    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024;

    private final EnhancementPipeline pipeline;
    private final StorageService storageService;
    private final FaceDetectionService faceDetectionService;

    // the model comes from server configuration only, never from the request
    @Value("${app.enhance.super-res-model:}")
    private String superResModel;

    public EnhancementController(EnhancementPipeline pipeline, StorageService storageService,
                                 FaceDetectionService faceDetectionService) {
        this.pipeline = pipeline;
        this.storageService = storageService;
        this.faceDetectionService = faceDetectionService;
    }

    @PostMapping(value = "/enhance", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> enhance(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "sharpen", defaultValue = "${app.enhance.default-sharpen:1.0}")
            @DecimalMin(value = "0.0", message = "Sharpen amount must be at least 0")
            @DecimalMax(value = "3.0", message = "Sharpen amount must be at most 3")
            double sharpen,
            @RequestParam(name = "scale", defaultValue = "${app.enhance.default-scale:2.0}")
            @DecimalMin(value = "1.0", message = "Scale must be at least 1")
            @DecimalMax(value = "4.0", message = "Scale must be at most 4")
            double scale
    ) throws IOException {

        validateUploadedFile(file);
        log.info("Processing file: {} ({}KB), sharpen: {}, scale: {}",
                file.getOriginalFilename(), file.getSize() / 1024, sharpen, scale);

        Mat input = storageService.decode(file.getBytes());
        FaceDetector detector = faceDetectionService.loadDefault();
        EnhancementResult result = pipeline.enhance(input, detector, new PipelineConfig(sharpen, superResModel, scale));

        byte[] png = storageService.encode(result.image(), ".png");
        log.info("Enhancement finished for {} (face found: {})", file.getOriginalFilename(), result.faceFound());

        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .header("X-Face-Found", String.valueOf(result.faceFound()))
                .header("X-Upscale-Method", result.upscaleMethod().name())
                .body(png);
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file format: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }
}
