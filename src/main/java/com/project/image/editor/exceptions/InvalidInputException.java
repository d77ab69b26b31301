package com.project.image.editor.exceptions;

/** Console input that cannot be used as an operation parameter. */
public class InvalidInputException extends ImageEditorException {
    public InvalidInputException(String message) { super(message); }
    public InvalidInputException(String message, Throwable cause) { super(message, cause); }
}
