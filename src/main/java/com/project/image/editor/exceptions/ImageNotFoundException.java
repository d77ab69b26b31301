package com.project.image.editor.exceptions;

/** The image path does not point to an existing file. */
public class ImageNotFoundException extends ImageEditorException {
    public ImageNotFoundException(String message) { super(message); }
}
