package com.project.image.editor.DTOs;

import java.util.Arrays;

/**
 * Decoded image: 8-bit RGB samples, row-major, interleaved (R, G, B per pixel).
 * Treated as immutable: operations always build a new buffer.
 */
public record PixelBuffer(int width, int height, byte[] rgb) {

    public static final int CHANNELS = 3;

    public PixelBuffer {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (rgb == null || rgb.length != width * height * CHANNELS) {
            throw new IllegalArgumentException("Sample array does not match " + width + "x" + height + "x3");
        }
    }

    /** Buffer filled with a single color. */
    public static PixelBuffer filled(int width, int height, int r, int g, int b) {
        byte[] data = new byte[width * height * CHANNELS];
        for (int i = 0; i < data.length; i += CHANNELS) {
            data[i] = (byte) r;
            data[i + 1] = (byte) g;
            data[i + 2] = (byte) b;
        }
        return new PixelBuffer(width, height, data);
    }

    public int pixelCount() {
        return width * height;
    }

    /** Unsigned sample value (0-255) of channel {@code c} at (x, y). */
    public int sample(int x, int y, int c) {
        return rgb[(y * width + x) * CHANNELS + c] & 0xFF;
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, Arrays.copyOf(rgb, rgb.length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgb);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
