package com.example.emotion.classifier;

import com.example.emotion.dto.FrameImage;
import com.example.emotion.util.NativeModelPool;
import com.example.emotion.util.OpenCvFrames;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RectVector;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_dnn.Net;
import org.bytedeco.opencv.opencv_objdetect.CascadeClassifier;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_dnn.blobFromImage;
import static org.bytedeco.opencv.global.opencv_dnn.readNetFromONNX;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * FER+ ONNX 情绪分类（OpenCV DNN推理）
 * <p>
 * 网络输入为64x64灰度人脸，输出8类得分：
 * neutral, happiness, surprise, sadness, anger, disgust, fear, contempt。
 * contempt 并入 disgust，再在7类词表上归一化。
 * 检测器与网络成对放在 {@link NativeModelPool} 中，不同会话可并行推理。
 */
@Slf4j
public class OpenCvDnnEmotionClassifier implements EmotionClassifier, AutoCloseable {

    private static final int INPUT_SIZE = 64;

    private static final Emotion[] FERPLUS_LABELS = {
            Emotion.NEUTRAL, Emotion.HAPPY, Emotion.SURPRISE, Emotion.SAD,
            Emotion.ANGRY, Emotion.DISGUST, Emotion.FEAR, Emotion.DISGUST
    };

    private final NativeModelPool<Models> pool;

    public OpenCvDnnEmotionClassifier(String cascadePath, String onnxModelPath, int poolSize) {
        if (!Files.exists(Paths.get(onnxModelPath))) {
            throw new IllegalArgumentException("情绪分类模型不存在: " + onnxModelPath);
        }
        this.pool = new NativeModelPool<>(getName(), poolSize, () -> new Models(cascadePath, onnxModelPath));
        log.info("✓ FER+ 情绪分类网络已加载: {}", onnxModelPath);
    }

    @Override
    public Optional<ClassifierResult> classify(FrameImage image) {
        return pool.execute(models -> classify(models, image));
    }

    private Optional<ClassifierResult> classify(Models models, FrameImage image) {
        CascadeClassifier faceDetector = models.faceDetector;
        Net net = models.net;
        try (Mat frame = OpenCvFrames.toMat(image);
             Mat gray = new Mat();
             RectVector faces = new RectVector()) {

            cvtColor(frame, gray, COLOR_BGR2GRAY);
            faceDetector.detectMultiScale(gray, faces);

            int largest = OpenCvFrames.largestFace(faces);
            if (largest < 0) {
                return Optional.empty();
            }

            Rect face = faces.get(largest);
            try (Mat crop = new Mat(gray, face);
                 Mat resized = new Mat();
                 Size inputSize = new Size(INPUT_SIZE, INPUT_SIZE);
                 Scalar mean = new Scalar(0.0)) {

                resize(crop, resized, inputSize);
                try (Mat blob = blobFromImage(resized, 1.0, inputSize, mean, false, false, CV_32F)) {
                    net.setInput(blob);
                    try (Mat output = net.forward()) {
                        return Optional.of(ClassifierResult.fromProbabilities(toProbabilities(output)));
                    }
                }
            }
        }
    }

    private Map<Emotion, Double> toProbabilities(Mat output) {
        float[] logits = new float[FERPLUS_LABELS.length];
        try (FloatIndexer indexer = output.createIndexer()) {
            for (int i = 0; i < logits.length; i++) {
                logits[i] = indexer.get(0, i);
            }
        }
        return softmax(logits);
    }

    /**
     * 数值稳定的softmax，并把FER+标签合并到分类器词表
     */
    static Map<Emotion, Double> softmax(float[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (float logit : logits) {
            max = Math.max(max, logit);
        }
        double[] exp = new double[logits.length];
        double sum = 0;
        for (int i = 0; i < logits.length; i++) {
            exp[i] = Math.exp(logits[i] - max);
            sum += exp[i];
        }

        Map<Emotion, Double> probabilities = new EnumMap<>(Emotion.class);
        for (Emotion emotion : Emotion.CLASSIFIER_VOCABULARY) {
            probabilities.put(emotion, 0.0);
        }
        for (int i = 0; i < logits.length; i++) {
            probabilities.merge(FERPLUS_LABELS[i], exp[i] / sum, Double::sum);
        }
        return probabilities;
    }

    @Override
    public String getName() {
        return "opencv-dnn-ferplus";
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
        private final Net net;

        Models(String cascadePath, String onnxModelPath) {
            this.faceDetector = new CascadeClassifier(cascadePath);
            if (faceDetector.empty()) {
                faceDetector.close();
                throw new IllegalStateException("无法加载人脸检测模型: " + cascadePath);
            }
            this.net = readNetFromONNX(onnxModelPath);
            if (net.empty()) {
                net.close();
                faceDetector.close();
                throw new IllegalStateException("无法加载情绪分类网络: " + onnxModelPath);
            }
        }

        @Override
        public void close() {
            net.close();
            faceDetector.close();
        }
    }
}
