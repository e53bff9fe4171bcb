package com.project.image.enhancement.service.processing;

import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the face to enhance and grows it into the region that is actually processed,
 * so that hairline and jaw are included.
 */
@Component
public class RegionSelector {
    private static final Logger log = LoggerFactory.getLogger(RegionSelector.class);

    public static final int DEFAULT_HORIZONTAL_PAD_DIVISOR = 8;
    public static final int DEFAULT_VERTICAL_PAD_DIVISOR = 6;

    private final int horizontalPadDivisor;
    private final int verticalPadDivisor;

    public RegionSelector(
            @Value("${app.enhance.roi.horizontal-pad-divisor:8}") int horizontalPadDivisor,
            @Value("${app.enhance.roi.vertical-pad-divisor:6}") int verticalPadDivisor) {
        if (horizontalPadDivisor <= 0 || verticalPadDivisor <= 0) {
            throw new IllegalArgumentException("Pad divisors must be positive");
        }
        this.horizontalPadDivisor = horizontalPadDivisor;
        this.verticalPadDivisor = verticalPadDivisor;
    }

    /**
     * Candidate with the largest area; the first one wins a tie.
     * Empty when there is nothing to choose from.
     */
    public Optional<Rect> selectLargest(List<Rect> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        Rect best = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            Rect r = candidates.get(i);
            if (area(r) > area(best)) {
                best = r;
            }
        }
        if (area(best) <= 0) {
            log.debug("Largest candidate {} has no area", best);
            return Optional.empty();
        }
        log.debug("Selected {} out of {} candidates", best, candidates.size());
        return Optional.of(best);
    }

    /**
     * Pads {@code rect} by width/8 on the left and right and height/6 on the top and
     * bottom, then clips to {@code [0, W) x [0, H)}.
     */
    public Rect expandAndClip(Rect rect, Size imageSize) {
        int imgW = (int) imageSize.width;
        int imgH = (int) imageSize.height;

        int padX = rect.width / horizontalPadDivisor;
        int padY = rect.height / verticalPadDivisor;

        int x0 = Math.max(0, rect.x - padX);
        int y0 = Math.max(0, rect.y - padY);
        int x1 = Math.min(imgW, rect.x + rect.width + padX);
        int y1 = Math.min(imgH, rect.y + rect.height + padY);

        if (x1 <= x0 || y1 <= y0) {
            throw new IllegalArgumentException("Region " + rect + " does not intersect image " + imgW + "x" + imgH);
        }
        Rect roi = new Rect(x0, y0, x1 - x0, y1 - y0);
        log.debug("Expanded {} to {} (padX={}, padY={})", rect, roi, padX, padY);
        return roi;
    }

    private static long area(Rect r) {
        return (long) r.width * r.height;
    }
}
