package com.project.image.editor.service;

import com.project.image.editor.DTOs.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Photometric adjustments on 8-bit RGB buffers. Every method returns a new buffer and leaves
 * its input untouched.
 *
 * Brightness, contrast, sharpness and saturation are "enhancers": the result is a linear
 * blend between a degenerate version of the image and the image itself,
 * {@code out = degenerate + factor * (in - degenerate)}, so that factor 1 gives back the
 * input and factor 0 gives the degenerate image.
 */
@Service
public class AdjustmentService {
    private static final Logger log = LoggerFactory.getLogger(AdjustmentService.class);

    // 3x3 smoothing kernel, weights sum to SMOOTH_SCALE
    private static final int[] SMOOTH_KERNEL = {
            1, 1, 1,
            1, 5, 1,
            1, 1, 1
    };
    private static final int SMOOTH_SCALE = 13;

    private static final double LN_2 = Math.log(2.0);

    /**
     * Power-law correction on normalized samples: {@code out = in^gamma}.
     * Values below 1 brighten, above 1 darken.
     */
    public PixelBuffer gamma(PixelBuffer input, double gamma) {
        if (!Double.isFinite(gamma) || gamma < 0) {
            throw new IllegalArgumentException("Gamma must be a non-negative number (got " + gamma + ")");
        }
        log.debug("Applying gamma {} to {}x{}", gamma, input.width(), input.height());
        int[] lut = new int[256];
        for (int v = 0; v < 256; v++) {
            lut[v] = toByte(Math.pow(v / 255.0, gamma));
        }
        return applyLut(input, lut);
    }

    /**
     * Logarithmic exposure curve on normalized samples: {@code out = gain * log2(1 + in)}.
     * With gain 1 black stays black and white stays white; larger gains clip highlights.
     */
    public PixelBuffer exposure(PixelBuffer input, double gain) {
        if (!Double.isFinite(gain)) {
            throw new IllegalArgumentException("Exposure gain must be a finite number (got " + gain + ")");
        }
        log.debug("Applying exposure gain {} to {}x{}", gain, input.width(), input.height());
        int[] lut = new int[256];
        for (int v = 0; v < 256; v++) {
            lut[v] = toByte(gain * Math.log1p(v / 255.0) / LN_2);
        }
        return applyLut(input, lut);
    }

    /** Scales all samples; 0 gives black. */
    public PixelBuffer brightness(PixelBuffer input, double factor) {
        log.debug("Applying brightness {} to {}x{}", factor, input.width(), input.height());
        PixelBuffer black = PixelBuffer.filled(input.width(), input.height(), 0, 0, 0);
        return blend(black, input, factor);
    }

    /** Scales the deviation from a gray at the mean luma; 0 gives a flat gray image. */
    public PixelBuffer contrast(PixelBuffer input, double factor) {
        int mean = meanLuma(input);
        log.debug("Applying contrast {} to {}x{} (mean luma {})", factor, input.width(), input.height(), mean);
        PixelBuffer gray = PixelBuffer.filled(input.width(), input.height(), mean, mean, mean);
        return blend(gray, input, factor);
    }

    /** Interpolates between a smoothed copy (factor 0) and the image; above 1 sharpens. */
    public PixelBuffer sharpness(PixelBuffer input, double factor) {
        log.debug("Applying sharpness {} to {}x{}", factor, input.width(), input.height());
        return blend(smooth(input), input, factor);
    }

    /** Interpolates between the grayscale copy (factor 0) and the image. */
    public PixelBuffer saturation(PixelBuffer input, double factor) {
        log.debug("Applying saturation {} to {}x{}", factor, input.width(), input.height());
        return blend(grayscale(input), input, factor);
    }

    /** ITU-R 601-2 luma, fixed point. */
    static int luma(int r, int g, int b) {
        return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
    }

    static int meanLuma(PixelBuffer image) {
        byte[] src = image.rgb();
        long sum = 0;
        for (int i = 0; i < src.length; i += PixelBuffer.CHANNELS) {
            sum += luma(src[i] & 0xFF, src[i + 1] & 0xFF, src[i + 2] & 0xFF);
        }
        return (int) (sum / (double) image.pixelCount() + 0.5);
    }

    static PixelBuffer grayscale(PixelBuffer image) {
        byte[] src = image.rgb();
        byte[] dst = new byte[src.length];
        for (int i = 0; i < src.length; i += PixelBuffer.CHANNELS) {
            byte l = (byte) luma(src[i] & 0xFF, src[i + 1] & 0xFF, src[i + 2] & 0xFF);
            dst[i] = l;
            dst[i + 1] = l;
            dst[i + 2] = l;
        }
        return new PixelBuffer(image.width(), image.height(), dst);
    }

    /** 3x3 smoothing; the one-pixel border is copied from the input. */
    static PixelBuffer smooth(PixelBuffer image) {
        final int w = image.width(), h = image.height();
        byte[] src = image.rgb();
        byte[] dst = src.clone();

        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                for (int c = 0; c < PixelBuffer.CHANNELS; c++) {
                    int sum = 0;
                    int k = 0;
                    for (int dy = -1; dy <= 1; dy++) {
                        for (int dx = -1; dx <= 1; dx++) {
                            sum += SMOOTH_KERNEL[k++] * (src[((y + dy) * w + (x + dx)) * 3 + c] & 0xFF);
                        }
                    }
                    dst[(y * w + x) * 3 + c] = (byte) clamp(Math.round(sum / (float) SMOOTH_SCALE));
                }
            }
        }
        return new PixelBuffer(w, h, dst);
    }

    static PixelBuffer blend(PixelBuffer degenerate, PixelBuffer image, double factor) {
        if (!Double.isFinite(factor)) {
            throw new IllegalArgumentException("Factor must be a finite number (got " + factor + ")");
        }
        if (factor == 1.0) {
            return image.copy();
        }
        if (factor == 0.0) {
            return degenerate.copy();
        }
        byte[] a = degenerate.rgb();
        byte[] b = image.rgb();
        byte[] dst = new byte[b.length];
        for (int i = 0; i < dst.length; i++) {
            int from = a[i] & 0xFF;
            double v = from + factor * ((b[i] & 0xFF) - from);
            dst[i] = (byte) clampTruncate(v);
        }
        return new PixelBuffer(image.width(), image.height(), dst);
    }

    private static PixelBuffer applyLut(PixelBuffer input, int[] lut) {
        byte[] src = input.rgb();
        byte[] dst = new byte[src.length];
        for (int i = 0; i < src.length; i++) {
            dst[i] = (byte) lut[src[i] & 0xFF];
        }
        return new PixelBuffer(input.width(), input.height(), dst);
    }

    /** Clips a normalized value to [0, 1] and rounds it to 0..255. */
    private static int toByte(double normalized) {
        double clipped = Math.max(0.0, Math.min(1.0, normalized));
        return (int) Math.rint(clipped * 255.0);
    }

    private static int clampTruncate(double v) {
        if (v <= 0.0) return 0;
        if (v >= 255.0) return 255;
        return (int) v;
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
