package com.project.image.editor.exceptions;

/** Writing an image (saved result or preview) failed. */
public class StorageException extends ImageEditorException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
