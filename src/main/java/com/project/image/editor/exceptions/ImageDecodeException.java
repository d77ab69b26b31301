package com.project.image.editor.exceptions;

/** The file exists but could not be decoded as an image. */
public class ImageDecodeException extends ImageEditorException {
    public ImageDecodeException(String message) { super(message); }
    public ImageDecodeException(String message, Throwable cause) { super(message, cause); }
}
