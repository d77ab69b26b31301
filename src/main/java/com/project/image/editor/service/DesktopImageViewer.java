package com.project.image.editor.service;

import com.project.image.editor.DTOs.PixelBuffer;
import com.project.image.editor.config.EditorProperties;
import com.project.image.editor.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the image as a PNG preview and hands it to the desktop's default viewer.
 * Without a desktop (headless, CI) the preview file is only written.
 */
@Service
public class DesktopImageViewer implements ImageViewer {
    private static final Logger log = LoggerFactory.getLogger(DesktopImageViewer.class);

    private final StorageService storageService;
    private final Path previewDir;

    public DesktopImageViewer(StorageService storageService, EditorProperties properties) {
        this.storageService = storageService;
        this.previewDir = properties.resolvedPreviewDir();
    }

    @Override
    public Path show(PixelBuffer image) {
        Path preview;
        try {
            Files.createDirectories(previewDir);
            preview = Files.createTempFile(previewDir, "image-editor-", ".png");
        } catch (IOException e) {
            throw new StorageException("Cannot create preview file in " + previewDir, e);
        }
        storageService.save(image, preview);

        if (canOpen()) {
            try {
                Desktop.getDesktop().open(preview.toFile());
                log.debug("Opened preview {}", preview);
            } catch (IOException e) {
                throw new StorageException("Cannot open viewer for " + preview + ": " + e.getMessage(), e);
            }
        } else {
            log.debug("No desktop available, preview written to {}", preview);
        }
        return preview;
    }

    private static boolean canOpen() {
        return !GraphicsEnvironment.isHeadless()
                && Desktop.isDesktopSupported()
                && Desktop.getDesktop().isSupported(Desktop.Action.OPEN);
    }
}
