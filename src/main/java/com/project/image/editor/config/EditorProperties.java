package com.project.image.editor.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Editor settings bound from {@code app.editor.*}. Every key has a default, so the editor
 * runs without any configuration file.
 *
 * @param interactive          start the console loop on startup
 * @param jpegQuality          quality used by "Save" for JPEG output (1-100)
 * @param pngCompressionLevel  deflate level for PNG output (0 = store, 9 = smallest)
 * @param autoShow             show the image after every applied operation
 * @param invalidInput         what to do with a parameter that is not a valid number
 * @param previewDir           directory for preview images, system temp dir when unset
 */
@Validated
@ConfigurationProperties(prefix = "app.editor")
public record EditorProperties(
        @DefaultValue("true") boolean interactive,
        @DefaultValue("100") @Min(1) @Max(100) int jpegQuality,
        @DefaultValue("1") @Min(0) @Max(9) int pngCompressionLevel,
        @DefaultValue("true") boolean autoShow,
        @DefaultValue("REPROMPT") @NotNull InvalidInputPolicy invalidInput,
        Path previewDir
) {

    /** Policy for numeric parameters that fail to parse. */
    public enum InvalidInputPolicy {
        /** Report the problem and ask again. */
        REPROMPT,
        /** Report the problem and end the session. */
        ABORT,
        /** Report the problem and continue with the default value. */
        DEFAULT
    }

    public static EditorProperties defaults() {
        return new EditorProperties(true, 100, 1, true, InvalidInputPolicy.REPROMPT, null);
    }

    public Path resolvedPreviewDir() {
        return previewDir != null ? previewDir : Path.of(System.getProperty("java.io.tmpdir"));
    }
}
