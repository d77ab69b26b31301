package com.project.image.editor.controller;

import com.project.image.editor.DTOs.PixelBuffer;

import java.util.Objects;

/**
 * The working image of one editing session and whether it changed since the last save.
 * Owned by a single {@link EditorController#run} call.
 */
public final class SessionState {
    private PixelBuffer current;
    private boolean modified;

    public SessionState(PixelBuffer loaded) {
        this.current = Objects.requireNonNull(loaded, "loaded");
    }

    public PixelBuffer current() {
        return current;
    }

    public boolean isModified() {
        return modified;
    }

    /** Replaces the working image with the result of an operation. */
    public void apply(PixelBuffer result) {
        this.current = Objects.requireNonNull(result, "result");
        this.modified = true;
    }

    public void markSaved() {
        this.modified = false;
    }
}
