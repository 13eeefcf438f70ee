package com.example.emotion.landmark;

import com.example.emotion.dto.FrameImage;
import com.example.emotion.util.NativeModelPool;
import com.example.emotion.util.OpenCvFrames;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.Point2fVector;
import org.bytedeco.opencv.opencv_core.Point2fVectorVector;
import org.bytedeco.opencv.opencv_core.RectVector;
import org.bytedeco.opencv.opencv_face.Facemark;
import org.bytedeco.opencv.opencv_face.FacemarkLBF;
import org.bytedeco.opencv.opencv_objdetect.CascadeClassifier;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.equalizeHist;

/**
 * OpenCV Haar级联人脸检测 + Facemark LBF 68点关键点
 * <p>
 * OpenCV对象不可并发使用，检测器与Facemark成对放在 {@link NativeModelPool} 中，每次提取独占一对。
 */
@Slf4j
public class OpenCvLandmarkExtractor implements LandmarkExtractor, AutoCloseable {

    private final NativeModelPool<Models> pool;

    public OpenCvLandmarkExtractor(String cascadePath, String facemarkModelPath, int poolSize) {
        if (!Files.exists(Paths.get(cascadePath))) {
            throw new IllegalArgumentException("人脸检测模型不存在: " + cascadePath);
        }
        if (!Files.exists(Paths.get(facemarkModelPath))) {
            throw new IllegalArgumentException("关键点模型不存在: " + facemarkModelPath);
        }
        this.pool = new NativeModelPool<>(getName(), poolSize, () -> new Models(cascadePath, facemarkModelPath));
        log.info("✓ Facemark LBF 关键点模型已加载: {}", facemarkModelPath);
    }

    @Override
    public Optional<LandmarkSet> extract(FrameImage image) {
        return pool.execute(models -> extract(models, image));
    }

    private Optional<LandmarkSet> extract(Models models, FrameImage image) {
        CascadeClassifier faceDetector = models.faceDetector;
        Facemark facemark = models.facemark;
        try (Mat frame = OpenCvFrames.toMat(image);
             Mat gray = new Mat();
             RectVector faces = new RectVector()) {

            cvtColor(frame, gray, COLOR_BGR2GRAY);
            equalizeHist(gray, gray);
            faceDetector.detectMultiScale(gray, faces);

            int largest = OpenCvFrames.largestFace(faces);
            if (largest < 0) {
                return Optional.empty();
            }

            try (RectVector selected = new RectVector(faces.get(largest));
                 Point2fVectorVector shapes = new Point2fVectorVector()) {

                if (!facemark.fit(frame, selected, shapes) || shapes.size() == 0) {
                    return Optional.empty();
                }

                Point2fVector shape = shapes.get(0);
                if (shape.size() != LandmarkScheme.IBUG_68.getPointCount()) {
                    log.debug("Facemark 返回 {} 个点，丢弃该帧", shape.size());
                    return Optional.empty();
                }

                List<LandmarkPoint> points = new ArrayList<>((int) shape.size());
                for (long i = 0; i < shape.size(); i++) {
                    Point2f p = shape.get(i);
                    points.add(new LandmarkPoint(p.x(), p.y(), 0.0));
                }
                return Optional.of(new LandmarkSet(LandmarkScheme.IBUG_68, points));
            }
        }
    }

    @Override
    public String getName() {
        return "opencv-facemark-lbf";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void close() {
        pool.close();
    }

    static final class Models implements AutoCloseable {
        private final CascadeClassifier faceDetector;
        private final Facemark facemark;

        Models(String cascadePath, String facemarkModelPath) {
            this.faceDetector = new CascadeClassifier(cascadePath);
            if (faceDetector.empty()) {
                faceDetector.close();
                throw new IllegalStateException("无法加载人脸检测模型: " + cascadePath);
            }
            this.facemark = FacemarkLBF.create();
            facemark.loadModel(facemarkModelPath);
        }

        @Override
        public void close() {
            facemark.close();
            faceDetector.close();
        }
    }
}
