package com.project.image.enhancement.exceptions;

/** The face detector model could not be loaded. Fatal for the run. */
public class DetectorLoadException extends EnhancementException {
    public DetectorLoadException(String message) { super(message); }
    public DetectorLoadException(String message, Throwable cause) { super(message, cause); }
}
