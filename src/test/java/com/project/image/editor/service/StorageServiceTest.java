package com.project.image.editor.service;

import com.project.image.editor.DTOs.PixelBuffer;
import com.project.image.editor.config.EditorProperties;
import com.project.image.editor.exceptions.ImageDecodeException;
import com.project.image.editor.exceptions.ImageNotFoundException;
import com.project.image.editor.exceptions.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;

import static org.assertj.core.api.Assertions.*;

class StorageServiceTest {
    private final StorageService storage = new StorageService(EditorProperties.defaults());

    @TempDir
    Path tmp;

    private static PixelBuffer pattern(int w, int h) {
        byte[] data = new byte[w * h * 3];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) ((i * 37) ^ (i >> 3));
        }
        return new PixelBuffer(w, h, data);
    }

    @Test
    void savePng_thenLoad_isPixelIdentical() {
        PixelBuffer image = pattern(40, 30);
        Path file = tmp.resolve("out.png");

        storage.save(image, file);

        assertThat(storage.load(file)).isEqualTo(image);
    }

    @Test
    void saveJpeg_thenLoad_keepsDimensions() {
        PixelBuffer image = pattern(33, 17);
        Path file = tmp.resolve("out.jpg");

        storage.save(image, file, 80);

        PixelBuffer loaded = storage.load(file);
        assertThat(loaded.width()).isEqualTo(33);
        assertThat(loaded.height()).isEqualTo(17);
    }

    @Test
    void saveJpeg_upperCaseExtension_writesFullChromaJpeg() throws Exception {
        Path file = tmp.resolve("OUT.JPEG");

        storage.save(PixelBuffer.filled(16, 16, 200, 40, 90), file);

        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            ImageReader reader = ImageIO.getImageReaders(in).next();
            try {
                reader.setInput(in);
                assertThat(reader.getFormatName()).isEqualToIgnoringCase("jpeg");
                IIOMetadata metadata = reader.getImageMetadata(0);
                Element tree = (Element) metadata.getAsTree("javax_imageio_jpeg_image_1.0");
                NodeList components = tree.getElementsByTagName("componentSpec");
                assertThat(components.getLength()).isEqualTo(3);
                for (int i = 0; i < components.getLength(); i++) {
                    Element component = (Element) components.item(i);
                    assertThat(component.getAttribute("HsamplingFactor")).isEqualTo("1");
                    assertThat(component.getAttribute("VsamplingFactor")).isEqualTo("1");
                }
            } finally {
                reader.dispose();
            }
        }
    }

    @Test
    void save_otherRegisteredFormat_usesSuffixWriter() {
        PixelBuffer image = pattern(10, 10);
        Path file = tmp.resolve("out.bmp");

        storage.save(image, file);

        assertThat(storage.load(file)).isEqualTo(image);
    }

    @Test
    void save_rejectsUnknownOrMissingExtension() {
        PixelBuffer image = pattern(4, 4);

        assertThatThrownBy(() -> storage.save(image, tmp.resolve("out.xyz")))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("xyz");
        assertThatThrownBy(() -> storage.save(image, tmp.resolve("noext")))
                .isInstanceOf(StorageException.class);
        assertThat(tmp.resolve("noext")).doesNotExist();
    }

    @Test
    void save_rejectsQualityOutOfRange() {
        assertThatThrownBy(() -> storage.save(pattern(4, 4), tmp.resolve("q.jpg"), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.save(pattern(4, 4), tmp.resolve("q.jpg"), 101))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void save_intoMissingDirectory_failsWithStorageException() {
        assertThatThrownBy(() -> storage.save(pattern(4, 4), tmp.resolve("missing/dir/out.png")))
                .isInstanceOf(StorageException.class);
    }

    @Test
    void load_missingFile_throwsNotFound() {
        assertThatThrownBy(() -> storage.load(tmp.resolve("nope.png")))
                .isInstanceOf(ImageNotFoundException.class);
    }

    @Test
    void load_nonImage_throwsDecodeError() throws Exception {
        Path text = Files.writeString(tmp.resolve("notes.png"), "definitely not a png");

        assertThatThrownBy(() -> storage.load(text))
                .isInstanceOf(ImageDecodeException.class);
    }

    @Test
    void load_convertsAlphaAndGrayToRgb() throws Exception {
        BufferedImage argb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(0, 0, 0x80FF0000);
        argb.setRGB(1, 0, 0x00000000);
        Path argbFile = tmp.resolve("alpha.png");
        ImageIO.write(argb, "png", argbFile.toFile());

        PixelBuffer fromArgb = storage.load(argbFile);
        assertThat(fromArgb.sample(0, 0, 0)).isEqualTo(255);
        assertThat(fromArgb.sample(0, 0, 1)).isZero();
        assertThat(fromArgb.rgb()).hasSize(2 * 3);

        BufferedImage gray = new BufferedImage(3, 2, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(1, 1, 0, 255);
        Path grayFile = tmp.resolve("gray.png");
        ImageIO.write(gray, "png", grayFile.toFile());

        PixelBuffer fromGray = storage.load(grayFile);
        assertThat(fromGray.rgb()).hasSize(3 * 2 * 3);
        assertThat(fromGray.sample(1, 1, 0)).isEqualTo(255);
        assertThat(fromGray.sample(1, 1, 2)).isEqualTo(255);
        assertThat(fromGray.sample(0, 0, 1)).isZero();
    }
}
