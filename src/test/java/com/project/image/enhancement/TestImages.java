package com.project.image.enhancement;

import com.project.image.enhancement.config.OpenCvNatives;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.util.Random;

/** Synthetic images for the tests. */
final class TestImages {

    static {
        OpenCvNatives.ensureLoaded();
    }

    private TestImages() {
    }

    /** Textured BGR image: smooth gradient plus seeded noise, so every stage has something to change. */
    static Mat textured(int width, int height, long seed) {
        Random rnd = new Random(seed);
        byte[] data = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (x * 255 / Math.max(1, width - 1) + y * 255 / Math.max(1, height - 1)) / 2;
                int i = (y * width + x) * 3;
                for (int c = 0; c < 3; c++) {
                    int v = base + rnd.nextInt(61) - 30 + c * 10;
                    data[i + c] = (byte) Math.max(0, Math.min(255, v));
                }
            }
        }
        Mat img = new Mat(height, width, CvType.CV_8UC3);
        img.put(0, 0, data);
        return img;
    }

    static Mat solid(int width, int height, double b, double g, double r) {
        return new Mat(height, width, CvType.CV_8UC3, new Scalar(b, g, r));
    }

    /** Number of differing pixel samples between two images of the same size and type. */
    static int differingSamples(Mat a, Mat b) {
        Mat diff = new Mat();
        Core.absdiff(a, b, diff);
        Mat flat = diff.reshape(1);
        return Core.countNonZero(flat);
    }

    static boolean identical(Mat a, Mat b) {
        return a.size().equals(b.size()) && a.type() == b.type() && differingSamples(a, b) == 0;
    }

    /** Mean absolute difference over {@code area}, all channels averaged. */
    static double meanAbsDiff(Mat a, Mat b, Rect area) {
        Mat diff = new Mat();
        Core.absdiff(a.submat(area), b.submat(area), diff);
        Scalar mean = Core.mean(diff);
        return (mean.val[0] + mean.val[1] + mean.val[2]) / 3.0;
    }

    static byte[] bytes(Mat m) {
        byte[] data = new byte[(int) (m.total() * m.channels())];
        m.get(0, 0, data);
        return data;
    }
}
