package com.project.image.editor.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns exceptions raised while handling a console command into the message shown to the
 * user, and logs them: domain errors at WARN, anything unexpected at ERROR with the trace.
 */
@Component
public class ConsoleExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ConsoleExceptionHandler.class);

    public String describe(Exception ex) {
        if (ex instanceof ImageNotFoundException) {
            log.warn("Image not found: {}", ex.getMessage());
            return "File not found: " + ex.getMessage();
        }
        if (ex instanceof ImageDecodeException) {
            log.warn("Image could not be decoded: {}", ex.getMessage());
            return "Not a readable image: " + ex.getMessage();
        }
        if (ex instanceof InvalidInputException || ex instanceof StorageException) {
            log.warn("Domain error: {}", ex.getMessage());
            return ex.getMessage();
        }
        if (ex instanceof IllegalArgumentException) {
            log.warn("Invalid argument: {}", ex.getMessage());
            return "Invalid parameter: " + ex.getMessage();
        }
        log.error("Unhandled error occurred", ex);
        return "Unexpected error: " + (ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
    }
}
