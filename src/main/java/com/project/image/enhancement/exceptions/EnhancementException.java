package com.project.image.enhancement.exceptions;

/** Domain-specific exception for enhancement errors. */
public class EnhancementException extends RuntimeException {
    public EnhancementException(String message) { super(message); }
    public EnhancementException(String message, Throwable cause) { super(message, cause); }
}
