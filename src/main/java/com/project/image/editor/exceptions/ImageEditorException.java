package com.project.image.editor.exceptions;

/** Base type for errors the editor reports to the user. */
public class ImageEditorException extends RuntimeException {
    public ImageEditorException(String message) { super(message); }
    public ImageEditorException(String message, Throwable cause) { super(message, cause); }
}
