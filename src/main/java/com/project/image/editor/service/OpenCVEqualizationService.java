package com.project.image.editor.service;

import com.project.image.editor.DTOs.PixelBuffer;
import com.project.image.editor.exceptions.ImageEditorException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Histogram equalization of the luma channel. Works in YCrCb so that only brightness is
 * redistributed; the chroma planes pass through unchanged.
 */
@Service
public class OpenCVEqualizationService {
    private static final Logger log = LoggerFactory.getLogger(OpenCVEqualizationService.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Exception e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    public PixelBuffer equalize(PixelBuffer input) {
        log.debug("Equalizing luma histogram of {}x{} image", input.width(), input.height());
        List<Mat> mats = new ArrayList<>();
        List<Mat> planes = new ArrayList<>();
        try {
            Mat rgb = track(mats, toMat(input));
            Mat ycrcb = track(mats, new Mat());
            Imgproc.cvtColor(rgb, ycrcb, Imgproc.COLOR_RGB2YCrCb);
            Core.split(ycrcb, planes);
            Imgproc.equalizeHist(planes.get(0), planes.get(0));
            Core.merge(planes, ycrcb);
            Imgproc.cvtColor(ycrcb, rgb, Imgproc.COLOR_YCrCb2RGB);
            return fromMat(rgb);
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            log.error("Histogram equalization failed", e);
            throw new ImageEditorException("Histogram equalization failed: " + e.getMessage(), e);
        } finally {
            mats.forEach(Mat::release);
            planes.forEach(Mat::release);
        }
    }

    private static Mat track(List<Mat> mats, Mat mat) {
        mats.add(mat);
        return mat;
    }

    private static Mat toMat(PixelBuffer buffer) {
        Mat mat = new Mat(buffer.height(), buffer.width(), CvType.CV_8UC3);
        mat.put(0, 0, buffer.rgb());
        return mat;
    }

    private static PixelBuffer fromMat(Mat mat) {
        byte[] data = new byte[(int) (mat.total() * mat.channels())];
        mat.get(0, 0, data);
        return new PixelBuffer(mat.cols(), mat.rows(), data);
    }
}
