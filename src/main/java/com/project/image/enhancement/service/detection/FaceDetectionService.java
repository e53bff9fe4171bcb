package com.project.image.enhancement.service.detection;

import com.project.image.enhancement.config.OpenCvNatives;
import com.project.image.enhancement.exceptions.DetectorLoadException;
import org.opencv.objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads Haar cascade face detectors. A path that does not exist on disk is looked up
 * on the classpath and extracted to a temporary file, because OpenCV only reads files.
 * Each classpath resource is extracted at most once; the copy is reused until a load
 * from it fails, at which point it is deleted.
 */
@Service
public class FaceDetectionService {
    private static final Logger log = LoggerFactory.getLogger(FaceDetectionService.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final DetectorSettings settings;
    private final Path defaultCascade;
    private final Map<String, Path> extractedCascades = new ConcurrentHashMap<>();

    public FaceDetectionService(
            @Value("${app.enhance.cascade-path:haarcascade_frontalface_default.xml}") String defaultCascade,
            @Value("${app.enhance.detector.scale-factor:1.2}") double scaleFactor,
            @Value("${app.enhance.detector.min-neighbors:5}") int minNeighbors,
            @Value("${app.enhance.detector.min-size:40}") int minSize) {
        this.defaultCascade = Path.of(defaultCascade);
        this.settings = new DetectorSettings(scaleFactor, minNeighbors, minSize);
    }

    /** Detector for the cascade configured in {@code app.enhance.cascade-path}. */
    public FaceDetector loadDefault() {
        return load(defaultCascade);
    }

    public FaceDetector load(Path cascadePath) {
        Path file = resolve(cascadePath);
        CascadeClassifier classifier = new CascadeClassifier();
        boolean loaded;
        try {
            loaded = classifier.load(file.toString());
        } catch (RuntimeException e) {
            discardExtracted(cascadePath, file);
            throw new DetectorLoadException("Failed to load cascade: " + cascadePath, e);
        }
        if (!loaded || classifier.empty()) {
            discardExtracted(cascadePath, file);
            throw new DetectorLoadException("Failed to load cascade: " + cascadePath);
        }
        log.info("Face detector loaded from {}", cascadePath);
        return new CascadeFaceDetector(classifier, settings);
    }

    private Path resolve(Path cascadePath) {
        if (Files.isRegularFile(cascadePath)) {
            return cascadePath;
        }
        return extract(resourceName(cascadePath));
    }

    private synchronized Path extract(String resource) {
        Path cached = extractedCascades.get(resource);
        if (cached != null && Files.isRegularFile(cached)) {
            return cached;
        }
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new DetectorLoadException("Cascade not found on disk or classpath: " + resource.substring(1));
            }
            Path tempFile = Files.createTempFile("haarcascade", ".xml");
            tempFile.toFile().deleteOnExit();
            Files.copy(is, tempFile, StandardCopyOption.REPLACE_EXISTING);
            extractedCascades.put(resource, tempFile);
            log.debug("Extracted classpath cascade {} to {}", resource, tempFile);
            return tempFile;
        } catch (IOException e) {
            throw new DetectorLoadException("Cannot extract cascade " + resource, e);
        }
    }

    private void discardExtracted(Path cascadePath, Path file) {
        if (file.equals(cascadePath)) {
            return;
        }
        extractedCascades.remove(resourceName(cascadePath), file);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete extracted cascade {}: {}", file, e.getMessage());
        }
    }

    private static String resourceName(Path cascadePath) {
        return "/" + cascadePath.getFileName();
    }
}
