package com.project.image.enhancement.service;

import com.project.image.enhancement.config.OpenCvNatives;
import com.project.image.enhancement.exceptions.ImageReadException;
import com.project.image.enhancement.exceptions.ImageWriteException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Image decode/encode. Read and write failures are fatal for a run and surface as
 * {@link ImageReadException} and {@link ImageWriteException}.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    public Mat load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ImageReadException("Failed to read input image: " + path);
        }
        Mat img = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        if (img.empty()) {
            throw new ImageReadException("Failed to read input image: " + path);
        }
        log.debug("Loaded {} ({}x{})", path, img.cols(), img.rows());
        return img;
    }

    public void save(Mat image, Path path) {
        Path target = path.toAbsolutePath().normalize();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new ImageWriteException("Failed to write output: " + path, e);
        }

        boolean written;
        try {
            written = Imgcodecs.imwrite(target.toString(), image);
        } catch (RuntimeException e) {
            throw new ImageWriteException("Failed to write output: " + path, e);
        }
        if (!written) {
            throw new ImageWriteException("Failed to write output: " + path);
        }
        log.info("Saved: {}", target);
    }

    public Mat decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ImageReadException("Empty upload");
        }
        Mat img = Imgcodecs.imdecode(new MatOfByte(data), Imgcodecs.IMREAD_COLOR);
        if (img == null || img.empty()) {
            throw new ImageReadException("The file is not a valid image or is corrupted.");
        }
        return img;
    }

    /**
     * @param extension file extension including the dot, e.g. {@code ".png"}
     */
    public byte[] encode(Mat image, String extension) {
        MatOfByte buf = new MatOfByte();
        boolean ok;
        try {
            ok = Imgcodecs.imencode(extension, image, buf);
        } catch (RuntimeException e) {
            throw new ImageWriteException("Failed to encode image as " + extension, e);
        }
        if (!ok) {
            throw new ImageWriteException("Failed to encode image as " + extension);
        }
        return buf.toArray();
    }
}
