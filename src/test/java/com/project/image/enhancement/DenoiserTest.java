package com.project.image.enhancement;

import com.project.image.enhancement.service.processing.Denoiser;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DenoiserTest {
    private final Denoiser denoiser = new Denoiser(Denoiser.DEFAULT_H, Denoiser.DEFAULT_H_COLOR,
            Denoiser.DEFAULT_TEMPLATE_WINDOW, Denoiser.DEFAULT_SEARCH_WINDOW);

    @Test
    void grainOnFlatRegion_isReduced() {
        Mat noisy = grainy(80, 60);

        Mat out = denoiser.denoise(noisy);

        assertThat(out.size()).isEqualTo(noisy.size());
        assertThat(out.type()).isEqualTo(noisy.type());
        assertThat(stdDev(out)).isLessThan(stdDev(noisy));
    }

    @Test
    void singleChannel_isSupported() {
        Mat gray = new Mat();
        Core.extractChannel(grainy(40, 40), gray, 0);

        Mat out = denoiser.denoise(gray);

        assertThat(out.type()).isEqualTo(CvType.CV_8UC1);
        assertThat(stdDev(out)).isLessThanOrEqualTo(stdDev(gray));
    }

    @Test
    void rejectsEvenWindows() {
        assertThatThrownBy(() -> new Denoiser(3, 3, 6, 21)).isInstanceOf(IllegalArgumentException.class);
    }

    // mid gray with +-2 grain, the kind left behind by sharpening
    private static Mat grainy(int w, int h) {
        Random rnd = new Random(7);
        byte[] data = new byte[w * h * 3];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (128 + rnd.nextInt(5) - 2);
        }
        Mat m = new Mat(h, w, CvType.CV_8UC3);
        m.put(0, 0, data);
        return m;
    }

    private static double stdDev(Mat m) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble dev = new MatOfDouble();
        Core.meanStdDev(m.reshape(1), mean, dev);
        return dev.toArray()[0];
    }
}
