package com.flowmable.epaper;

/**
 * A photo could not be turned into a frame. Nothing was stored.
 */
public class ImageProcessingException extends Exception {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
