package com.project.image.enhancement.exceptions;

public class ImageWriteException extends StorageException {
    public ImageWriteException(String message) { super(message); }
    public ImageWriteException(String message, Throwable cause) { super(message, cause); }
}
