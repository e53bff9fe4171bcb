package com.project.image.enhancement.service.processing;

import com.project.image.enhancement.config.OpenCvNatives;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Contrast limited adaptive histogram equalization on the luma channel only.
 * Chroma is left untouched so skin tones keep their color.
 */
@Component
public class ContrastEqualizer {
    private static final Logger log = LoggerFactory.getLogger(ContrastEqualizer.class);

    public static final double DEFAULT_CLIP_LIMIT = 2.0;
    public static final int DEFAULT_TILE_GRID = 8;

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final double clipLimit;
    private final int tileGrid;

    public ContrastEqualizer(@Value("${app.enhance.clahe.clip-limit:2.0}") double clipLimit,
                             @Value("${app.enhance.clahe.tile-grid:8}") int tileGrid) {
        if (clipLimit <= 0 || tileGrid <= 0) {
            throw new IllegalArgumentException("CLAHE clip limit and tile grid must be positive");
        }
        this.clipLimit = clipLimit;
        this.tileGrid = tileGrid;
    }

    public Mat enhanceLocalContrast(Mat region) {
        // CLAHE keeps internal state, one instance per call
        CLAHE clahe = Imgproc.createCLAHE(clipLimit, new Size(tileGrid, tileGrid));

        if (region.channels() == 1) {
            Mat out = new Mat();
            clahe.apply(region, out);
            return out;
        }

        Mat ycrcb = new Mat();
        Imgproc.cvtColor(region, ycrcb, Imgproc.COLOR_BGR2YCrCb);
        List<Mat> channels = new ArrayList<>();
        Core.split(ycrcb, channels);

        Mat luma = new Mat();
        clahe.apply(channels.get(0), luma);
        channels.set(0, luma);
        Core.merge(channels, ycrcb);

        Mat out = new Mat();
        Imgproc.cvtColor(ycrcb, out, Imgproc.COLOR_YCrCb2BGR);
        log.debug("Equalized luma of {}x{} region (clip={}, grid={})", region.cols(), region.rows(), clipLimit, tileGrid);
        return out;
    }
}
