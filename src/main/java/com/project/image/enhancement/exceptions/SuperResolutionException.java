package com.project.image.enhancement.exceptions;

/**
 * Failure inside the super-resolution backend. Never leaves the upscaler:
 * it is caught there and replaced by bicubic interpolation.
 */
public class SuperResolutionException extends RuntimeException {
    public SuperResolutionException(String message) { super(message); }
    public SuperResolutionException(String message, Throwable cause) { super(message, cause); }
}
