package com.flowmable.epaper;

/**
 * The uploaded bytes are not an image format the JDK image readers understand.
 */
public class ImageDecodeException extends ImageProcessingException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
