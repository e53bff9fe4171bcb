package com.project.image.enhancement.service.processing;

import com.project.image.enhancement.config.OpenCvNatives;
import org.opencv.core.Mat;
import org.opencv.photo.Photo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Mild non-local means pass that removes the grain left by sharpening and equalization.
 */
@Component
public class Denoiser {
    private static final Logger log = LoggerFactory.getLogger(Denoiser.class);

    public static final float DEFAULT_H = 3f;
    public static final float DEFAULT_H_COLOR = 3f;
    public static final int DEFAULT_TEMPLATE_WINDOW = 7;
    public static final int DEFAULT_SEARCH_WINDOW = 21;

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final float h;
    private final float hColor;
    private final int templateWindow;
    private final int searchWindow;

    public Denoiser(@Value("${app.enhance.denoise.h:3}") float h,
                    @Value("${app.enhance.denoise.h-color:3}") float hColor,
                    @Value("${app.enhance.denoise.template-window:7}") int templateWindow,
                    @Value("${app.enhance.denoise.search-window:21}") int searchWindow) {
        if (templateWindow % 2 == 0 || searchWindow % 2 == 0) {
            throw new IllegalArgumentException("Denoise windows must be odd: " + templateWindow + ", " + searchWindow);
        }
        this.h = h;
        this.hColor = hColor;
        this.templateWindow = templateWindow;
        this.searchWindow = searchWindow;
    }

    public Mat denoise(Mat region) {
        Mat out = new Mat();
        if (region.channels() == 1) {
            Photo.fastNlMeansDenoising(region, out, h, templateWindow, searchWindow);
        } else {
            Photo.fastNlMeansDenoisingColored(region, out, h, hColor, templateWindow, searchWindow);
        }
        log.debug("Denoised {}x{} region", region.cols(), region.rows());
        return out;
    }
}
