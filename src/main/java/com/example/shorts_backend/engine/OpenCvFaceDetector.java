package com.example.shorts_backend.engine;

import com.example.shorts_backend.engine.Interfaces.FaceDetector;
import com.example.shorts_backend.engine.Interfaces.MediaSampler;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfRect;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds frontal faces with an OpenCV Haar cascade, run over grayscale frames decoded by the
 * {@link MediaSampler}.
 *
 * <p>Detection parameters: scale factor 1.1, 5 neighbours, faces smaller than 30x30 pixels are
 * ignored. By default the frontal-face cascade bundled on the classpath is used; a cascade file on
 * disk can be configured instead.
 */
public class OpenCvFaceDetector implements FaceDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenCvFaceDetector.class);

    public static final String BUNDLED_CASCADE = "opencv/haarcascade_frontalface_default.xml";

    private static final double SCALE_FACTOR = 1.1;
    private static final int MIN_NEIGHBORS = 5;
    private static final Size MIN_FACE = new Size(30, 30);

    private static Boolean nativeLoaded;

    private final MediaSampler sampler;
    private final int frameWidth;
    private final int frameHeight;
    private final String cascadeFile;

    private Path cascadePath;

    /**
     * @param cascadeFile path of a cascade XML on disk, or {@code null}/blank for the bundled one.
     */
    public OpenCvFaceDetector(MediaSampler sampler, int frameWidth, int frameHeight, String cascadeFile) {
        this.sampler = sampler;
        this.frameWidth = frameWidth > 0 ? frameWidth : 640;
        this.frameHeight = frameHeight > 0 ? frameHeight : 360;
        this.cascadeFile = cascadeFile;
    }

    @Override
    public boolean isAvailable() {
        if (!loadNative()) {
            return false;
        }
        try {
            CascadeClassifier classifier = newClassifier();
            boolean ok = !classifier.empty();
            if (!ok) {
                LOGGER.warn("Face cascade could not be loaded from {}", cascadePath);
            }
            return ok;
        } catch (IOException e) {
            LOGGER.warn("Face cascade not readable: {}", e.toString());
            return false;
        }
    }

    @Override
    public List<FrameFaces> detect(Path mediaFile, double intervalSec) throws Exception {
        if (mediaFile == null || !Files.exists(mediaFile)) {
            throw new IllegalArgumentException("Input file not found: " + mediaFile);
        }
        if (!loadNative()) {
            throw new IllegalStateException("OpenCV native library is not available");
        }
        CascadeClassifier classifier = newClassifier();
        if (classifier.empty()) {
            throw new IllegalStateException("Face cascade could not be loaded from " + cascadePath);
        }
        List<FrameFaces> frames = new ArrayList<>();
        MediaSampler.FrameSpec spec = new MediaSampler.FrameSpec(intervalSec, frameWidth, frameHeight);
        sampler.streamGrayFrames(mediaFile, spec, frame -> frames.add(detectIn(classifier, frame)));
        LOGGER.debug("Face detection done file={} frames={}", mediaFile.getFileName(), frames.size());
        return frames;
    }

    FrameFaces detectIn(CascadeClassifier classifier, MediaSampler.GrayFrame frame) {
        Mat gray = new Mat(frame.height(), frame.width(), CvType.CV_8UC1);
        Mat equalized = new Mat();
        MatOfRect found = new MatOfRect();
        try {
            gray.put(0, 0, frame.pixels());
            Imgproc.equalizeHist(gray, equalized);
            classifier.detectMultiScale(equalized, found, SCALE_FACTOR, MIN_NEIGHBORS, 0, MIN_FACE, new Size());
            List<FaceBox> faces = new ArrayList<>();
            for (Rect r : found.toArray()) {
                faces.add(new FaceBox(r.x, r.y, r.width, r.height));
            }
            return new FrameFaces(frame.timeSec(), frame.width(), frame.height(), faces);
        } finally {
            found.release();
            equalized.release();
            gray.release();
        }
    }

    // CascadeClassifier is not safe to share between threads, so every run gets its own.
    private CascadeClassifier newClassifier() throws IOException {
        return new CascadeClassifier(resolveCascade().toString());
    }

    private synchronized Path resolveCascade() throws IOException {
        if (cascadePath != null) {
            return cascadePath;
        }
        if (cascadeFile != null && !cascadeFile.isBlank()) {
            Path configured = Path.of(cascadeFile).toAbsolutePath();
            if (!Files.isReadable(configured)) {
                throw new IOException("Cascade file not readable: " + configured);
            }
            cascadePath = configured;
            return cascadePath;
        }
        try (InputStream in = OpenCvFaceDetector.class.getClassLoader().getResourceAsStream(BUNDLED_CASCADE)) {
            if (in == null) {
                throw new IOException("Bundled cascade missing from classpath: " + BUNDLED_CASCADE);
            }
            Path tmp = Files.createTempFile("face-cascade-", ".xml");
            tmp.toFile().deleteOnExit();
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            cascadePath = tmp;
            return cascadePath;
        }
    }

    static synchronized boolean loadNative() {
        if (nativeLoaded == null) {
            try {
                OpenCV.loadLocally();
                nativeLoaded = true;
                LOGGER.info("OpenCV native library loaded");
            } catch (RuntimeException | LinkageError e) {
                LOGGER.warn("OpenCV native library could not be loaded: {}", e.toString());
                nativeLoaded = false;
            }
        }
        return nativeLoaded;
    }
}
