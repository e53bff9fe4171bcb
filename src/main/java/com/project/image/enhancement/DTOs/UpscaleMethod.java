package com.project.image.enhancement.DTOs;

public enum UpscaleMethod {
    /** Scale at or below the no-op threshold, region returned as is. */
    NONE,
    INTERPOLATION,
    SUPER_RESOLUTION,
    /** Super-resolution was requested but failed, bicubic interpolation was used instead. */
    INTERPOLATION_FALLBACK
}
