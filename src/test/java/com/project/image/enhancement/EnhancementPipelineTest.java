package com.project.image.enhancement;

import com.project.image.enhancement.DTOs.EnhancementResult;
import com.project.image.enhancement.DTOs.PipelineConfig;
import com.project.image.enhancement.DTOs.UpscaleMethod;
import com.project.image.enhancement.exceptions.EnhancementException;
import com.project.image.enhancement.exceptions.SuperResolutionException;
import com.project.image.enhancement.service.EnhancementPipeline;
import com.project.image.enhancement.service.StorageService;
import com.project.image.enhancement.service.detection.FaceDetectionService;
import com.project.image.enhancement.service.detection.FaceDetector;
import com.project.image.enhancement.service.processing.ContrastEqualizer;
import com.project.image.enhancement.service.processing.Denoiser;
import com.project.image.enhancement.service.processing.FeatherCompositor;
import com.project.image.enhancement.service.processing.RegionSelector;
import com.project.image.enhancement.service.processing.Sharpener;
import com.project.image.enhancement.service.processing.Upscaler;
import com.project.image.enhancement.service.superres.SuperResolutionAlgorithm;
import com.project.image.enhancement.service.superres.SuperResolutionBackend;
import com.project.image.enhancement.service.superres.SuperResolutionBackendFactory;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnhancementPipelineTest {

    private static final Rect FACE = new Rect(200, 150, 100, 100);
    private static final Rect PADDED_ROI = new Rect(188, 134, 124, 132);

    static EnhancementPipeline pipeline(SuperResolutionBackendFactory backendFactory) {
        return pipeline(backendFactory, new FaceDetectionService("haarcascade_frontalface_default.xml", 1.2, 5, 40));
    }

    static EnhancementPipeline pipeline(SuperResolutionBackendFactory backendFactory,
                                        FaceDetectionService faceDetectionService) {
        return new EnhancementPipeline(
                new RegionSelector(RegionSelector.DEFAULT_HORIZONTAL_PAD_DIVISOR, RegionSelector.DEFAULT_VERTICAL_PAD_DIVISOR),
                new Upscaler(backendFactory),
                new Sharpener(),
                new ContrastEqualizer(ContrastEqualizer.DEFAULT_CLIP_LIMIT, ContrastEqualizer.DEFAULT_TILE_GRID),
                new Denoiser(Denoiser.DEFAULT_H, Denoiser.DEFAULT_H_COLOR,
                        Denoiser.DEFAULT_TEMPLATE_WINDOW, Denoiser.DEFAULT_SEARCH_WINDOW),
                new FeatherCompositor(),
                new StorageService(),
                faceDetectionService);
    }

    @Test
    void scenarioA_faceIsEnhancedInsidePaddedRoiOnly() {
        Mat input = TestImages.textured(800, 600, 100);
        Mat pristine = input.clone();
        EnhancementPipeline pipeline = pipeline(() -> {
            throw new AssertionError("no backend without a model");
        });

        EnhancementResult result = pipeline.enhance(input, gray -> List.of(FACE), new PipelineConfig(1.0, "", 2.0));

        Mat out = result.image();
        assertThat(out.size()).isEqualTo(new Size(800, 600));
        assertThat(out.type()).isEqualTo(CvType.CV_8UC3);
        assertThat(result.faceFound()).isTrue();
        assertThat(result.roi()).contains(PADDED_ROI);
        assertThat(result.upscaleMethod()).isEqualTo(UpscaleMethod.INTERPOLATION);

        // outside the ROI nothing changed
        Mat expectedOutside = pristine.clone();
        out.submat(PADDED_ROI).copyTo(expectedOutside.submat(PADDED_ROI));
        assertThat(TestImages.identical(expectedOutside, out)).isTrue();

        // the ROI border moved less than its centre
        double centre = TestImages.meanAbsDiff(out, pristine, new Rect(PADDED_ROI.x + 42, PADDED_ROI.y + 46, 40, 40));
        double border = borderDiff(out, pristine, PADDED_ROI);
        assertThat(centre).isGreaterThan(0.0);
        assertThat(border).isLessThan(centre);

        // the caller's image is untouched
        assertThat(TestImages.identical(pristine, input)).isTrue();
    }

    @Test
    void scenarioB_noDetectionPassesOriginalThrough() {
        Mat input = TestImages.textured(800, 600, 200);
        EnhancementPipeline pipeline = pipeline(() -> {
            throw new AssertionError("no backend expected");
        });

        EnhancementResult result = pipeline.enhance(input, gray -> List.of(), new PipelineConfig(1.0, "", 2.0));

        assertThat(result.faceFound()).isFalse();
        assertThat(result.roi()).isEmpty();
        assertThat(result.upscaleMethod()).isEqualTo(UpscaleMethod.NONE);
        assertThat(TestImages.bytes(result.image())).isEqualTo(TestImages.bytes(input));
    }

    @Test
    void scenarioC_failingBackendStillDoublesTheRegion() {
        Mat input = TestImages.textured(800, 600, 300);
        List<String> backendCalls = new ArrayList<>();
        EnhancementPipeline pipeline = pipeline(() -> new ThrowingOnUpsample(backendCalls));

        EnhancementResult result = pipeline.enhance(input, gray -> List.of(FACE),
                new PipelineConfig(1.0, "models/EDSR_x2.pb", 2.0));

        assertThat(backendCalls).containsExactly("read", "set EDSR x2", "upsample");
        assertThat(result.upscaleMethod()).isEqualTo(UpscaleMethod.INTERPOLATION_FALLBACK);
        assertThat(result.enhancedRegionSize()).isEqualTo(new Size(PADDED_ROI.width * 2, PADDED_ROI.height * 2));
        assertThat(result.image().size()).isEqualTo(input.size());
        assertThat(result.faceFound()).isTrue();
    }

    @Test
    void detectorReceivesEqualizedGrayscale() {
        Mat input = TestImages.textured(120, 90, 400);
        List<Mat> seen = new ArrayList<>();
        FaceDetector detector = gray -> {
            seen.add(gray);
            return List.of();
        };

        pipeline(() -> null).enhance(input, detector, PipelineConfig.defaults());

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).type()).isEqualTo(CvType.CV_8UC1);
        assertThat(seen.get(0).size()).isEqualTo(input.size());
    }

    @Test
    void largestOfSeveralFacesIsProcessed() {
        Mat input = TestImages.textured(400, 300, 500);
        List<Rect> faces = List.of(new Rect(10, 10, 40, 40), new Rect(150, 100, 90, 90), new Rect(300, 200, 60, 60));

        EnhancementResult result = pipeline(() -> null).enhance(input, gray -> faces, new PipelineConfig(0.5, "", 1.0));

        // padX = 90 / 8 = 11, padY = 90 / 6 = 15
        assertThat(result.roi()).contains(new Rect(139, 85, 112, 120));
        assertThat(result.upscaleMethod()).isEqualTo(UpscaleMethod.NONE);
        assertThat(result.enhancedRegionSize()).isEqualTo(new Size(112, 120));
    }

    @Test
    void rejectsNonColorInput() {
        Mat gray = new Mat(10, 10, CvType.CV_8UC1);
        assertThatThrownBy(() -> pipeline(() -> null).enhance(gray, g -> List.of(), PipelineConfig.defaults()))
                .isInstanceOf(EnhancementException.class);
    }

    private static double borderDiff(Mat a, Mat b, Rect roi) {
        double top = TestImages.meanAbsDiff(a, b, new Rect(roi.x, roi.y, roi.width, 1));
        double bottom = TestImages.meanAbsDiff(a, b, new Rect(roi.x, roi.y + roi.height - 1, roi.width, 1));
        double left = TestImages.meanAbsDiff(a, b, new Rect(roi.x, roi.y, 1, roi.height));
        double right = TestImages.meanAbsDiff(a, b, new Rect(roi.x + roi.width - 1, roi.y, 1, roi.height));
        return (top + bottom + left + right) / 4.0;
    }

    private static final class ThrowingOnUpsample implements SuperResolutionBackend {
        private final List<String> calls;

        ThrowingOnUpsample(List<String> calls) {
            this.calls = calls;
        }

        @Override
        public void readModel(Path modelPath) {
            calls.add("read");
        }

        @Override
        public void setModel(SuperResolutionAlgorithm algorithm, int scale) {
            calls.add("set " + algorithm + " x" + scale);
        }

        @Override
        public Mat upsample(Mat image) {
            calls.add("upsample");
            throw new SuperResolutionException("unsupported layer");
        }
    }
}
