package com.project.image.enhancement.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp jar exactly once.
 * Classes touching {@code org.opencv} call {@link #ensureLoaded()} from a static block.
 */
public final class OpenCvNatives {
    private static final Logger log = LoggerFactory.getLogger(OpenCvNatives.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
            throw e;
        }
    }

    private OpenCvNatives() {
    }

    public static void ensureLoaded() {
        // class initialization does the work
    }
}
