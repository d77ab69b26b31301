package com.project.image.editor.service;

import com.project.image.editor.DTOs.PixelBuffer;

import java.nio.file.Path;

/** Shows an image to the user. */
@FunctionalInterface
public interface ImageViewer {

    /**
     * Displays {@code image}.
     *
     * @return the file the image was rendered to
     */
    Path show(PixelBuffer image);
}
