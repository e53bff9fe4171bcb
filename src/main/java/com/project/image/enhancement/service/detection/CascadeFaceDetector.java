package com.project.image.enhancement.service.detection;

import com.project.image.enhancement.config.OpenCvNatives;
import org.opencv.core.Mat;
import org.opencv.core.MatOfRect;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.objdetect.CascadeClassifier;
import org.opencv.objdetect.Objdetect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Haar cascade detector. Not thread-safe; create one per run. */
public class CascadeFaceDetector implements FaceDetector {
    private static final Logger log = LoggerFactory.getLogger(CascadeFaceDetector.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final CascadeClassifier classifier;
    private final DetectorSettings settings;

    CascadeFaceDetector(CascadeClassifier classifier, DetectorSettings settings) {
        this.classifier = classifier;
        this.settings = settings;
    }

    @Override
    public List<Rect> detect(Mat grayEqualized) {
        MatOfRect faces = new MatOfRect();
        classifier.detectMultiScale(grayEqualized, faces, settings.scaleFactor(), settings.minNeighbors(),
                Objdetect.CASCADE_SCALE_IMAGE, settings.minSizeAsSize(), new Size());
        List<Rect> found = faces.toList();
        log.debug("Cascade found {} candidate(s)", found.size());
        return found;
    }
}
