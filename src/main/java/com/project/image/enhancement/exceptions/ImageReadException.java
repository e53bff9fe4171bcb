package com.project.image.enhancement.exceptions;

public class ImageReadException extends StorageException {
    public ImageReadException(String message) { super(message); }
    public ImageReadException(String message, Throwable cause) { super(message, cause); }
}
