package com.project.image.editor.service;

import com.project.image.editor.DTOs.PixelBuffer;
import com.project.image.editor.config.EditorProperties;
import com.project.image.editor.exceptions.ImageDecodeException;
import com.project.image.editor.exceptions.ImageNotFoundException;
import com.project.image.editor.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;

/**
 * Reads images into {@link PixelBuffer}s and writes buffers back to disk.
 * The output format follows the file extension; JPEG and PNG get tuned encoder settings.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);

    private static final String JPEG_METADATA_FORMAT = "javax_imageio_jpeg_image_1.0";

    private final EditorProperties properties;

    public StorageService(EditorProperties properties) {
        this.properties = properties;
    }

    public PixelBuffer load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ImageNotFoundException(path.toString());
        }
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageDecodeException(path + " (" + e.getMessage() + ")", e);
        }
        if (image == null) {
            throw new ImageDecodeException(path + " is not a recognized image format");
        }
        log.info("Loaded {} ({}x{}, type {})", path, image.getWidth(), image.getHeight(), image.getType());
        return toPixelBuffer(image);
    }

    public void save(PixelBuffer buffer, Path path) {
        save(buffer, path, properties.jpegQuality());
    }

    public void save(PixelBuffer buffer, Path path, int quality) {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("JPEG quality must be between 1 and 100 (got " + quality + ")");
        }
        String ext = extensionOf(path);
        BufferedImage image = toBufferedImage(buffer);
        try {
            switch (ext) {
                case "jpg", "jpeg" -> writeJpeg(image, path, quality);
                case "png" -> writePng(image, path, properties.pngCompressionLevel());
                default -> writeBySuffix(image, path, ext);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to save " + path + ": " + e.getMessage(), e);
        }
        log.info("Saved {}x{} image to {}", buffer.width(), buffer.height(), path);
    }

    /** Converts any decoded image to 8-bit RGB. Alpha is dropped, not composited. */
    public static PixelBuffer toPixelBuffer(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] rgb = new byte[w * h * PixelBuffer.CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            rgb[3 * i] = (byte) (p >> 16);
            rgb[3 * i + 1] = (byte) (p >> 8);
            rgb[3 * i + 2] = (byte) p;
        }
        return new PixelBuffer(w, h, rgb);
    }

    public static BufferedImage toBufferedImage(PixelBuffer buffer) {
        int w = buffer.width(), h = buffer.height();
        byte[] rgb = buffer.rgb();
        int[] packed = new int[w * h];
        for (int i = 0; i < packed.length; i++) {
            packed[i] = ((rgb[3 * i] & 0xFF) << 16) | ((rgb[3 * i + 1] & 0xFF) << 8) | (rgb[3 * i + 2] & 0xFF);
        }
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, w, h, packed, 0, w);
        return image;
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            throw new StorageException("Cannot determine output format of " + path + " (no file extension)");
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private void writeJpeg(BufferedImage image, Path path, int quality) throws IOException {
        ImageWriter writer = firstWriter(ImageIO.getImageWritersByFormatName("jpeg"), "jpeg");
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality / 100f);
            if (param instanceof JPEGImageWriteParam jpegParam) {
                jpegParam.setOptimizeHuffmanTables(true);
            }
            IIOMetadata metadata = writer.getDefaultImageMetadata(new ImageTypeSpecifier(image), param);
            disableChromaSubsampling(metadata);
            write(writer, new IIOImage(image, null, metadata), param, path);
        } finally {
            writer.dispose();
        }
        log.debug("JPEG written with quality={}, 4:4:4 sampling, optimized Huffman tables", quality);
    }

    private void writePng(BufferedImage image, Path path, int compressionLevel) throws IOException {
        ImageWriter writer = firstWriter(ImageIO.getImageWritersByFormatName("png"), "png");
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                // The JDK PNG writer maps quality q to deflate level 9 - round(9 * q)
                param.setCompressionQuality((9 - compressionLevel) / 9f);
            }
            write(writer, new IIOImage(image, null, null), param, path);
        } finally {
            writer.dispose();
        }
        log.debug("PNG written with deflate level {}", compressionLevel);
    }

    private void writeBySuffix(BufferedImage image, Path path, String ext) throws IOException {
        ImageWriter writer = firstWriter(ImageIO.getImageWritersBySuffix(ext), ext);
        try {
            write(writer, new IIOImage(image, null, null), writer.getDefaultWriteParam(), path);
        } finally {
            writer.dispose();
        }
    }

    private static void write(ImageWriter writer, IIOImage image, ImageWriteParam param, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            writer.write(null, image, param);
            ios.flush();
        }
    }

    private static ImageWriter firstWriter(Iterator<ImageWriter> writers, String format) {
        if (!writers.hasNext()) {
            throw new StorageException("Unsupported output format: " + format);
        }
        return writers.next();
    }

    private static void disableChromaSubsampling(IIOMetadata metadata) throws IOException {
        Element tree = (Element) metadata.getAsTree(JPEG_METADATA_FORMAT);
        NodeList components = tree.getElementsByTagName("componentSpec");
        for (int i = 0; i < components.getLength(); i++) {
            Element component = (Element) components.item(i);
            component.setAttribute("HsamplingFactor", "1");
            component.setAttribute("VsamplingFactor", "1");
        }
        metadata.setFromTree(JPEG_METADATA_FORMAT, tree);
    }
}
