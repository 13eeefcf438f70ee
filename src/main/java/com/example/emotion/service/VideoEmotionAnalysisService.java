package com.example.emotion.service;

import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.dto.FrameAnalysis;
import com.example.emotion.dto.SessionSummary;
import com.example.emotion.dto.VideoAnalysisRequest;
import com.example.emotion.dto.VideoAnalysisResult;
import com.example.emotion.util.FrameImages;
import com.example.emotion.util.FrameSampler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;
import org.bytedeco.javacv.OpenCVFrameGrabber;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * 离线视频 / 摄像头情绪分析：按配置帧率抽帧，逐帧送入独立会话，结束后返回会话汇总
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoEmotionAnalysisService {

    private static final double DEFAULT_WEBCAM_SECONDS = 60.0;

    private final EmotionPipelineService pipelineService;
    private final EmotionAnalysisProperties properties;

    public Mono<VideoAnalysisResult> analyzeVideo(VideoAnalysisRequest request) {
        return Mono.fromCallable(() -> {
            String sessionId = request.getSessionId() != null && !request.getSessionId().trim().isEmpty()
                    ? request.getSessionId()
                    : "video-" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS"));

            log.info("开始分析视频情绪: {}, 会话: {}", request.getVideoSource(), sessionId);
            try {
                return processVideo(request, sessionId);
            } catch (Exception e) {
                log.error("视频情绪分析失败: {}", e.getMessage(), e);
                return VideoAnalysisResult.builder()
                        .success(false)
                        .error(e.getMessage())
                        .message("视频情绪分析失败: " + e.getMessage())
                        .videoSource(request.getVideoSource())
                        .sessionId(sessionId)
                        .build();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private VideoAnalysisResult processVideo(VideoAnalysisRequest request, String sessionId) throws Exception {
        String videoSource = request.getVideoSource();
        if (videoSource == null || videoSource.trim().isEmpty()) {
            throw new IllegalArgumentException("视频源路径不能为空");
        }
        boolean isWebcam = videoSource.matches("\\d+");
        if (!isWebcam && !Files.exists(Paths.get(videoSource))) {
            throw new IllegalArgumentException("视频文件不存在: " + videoSource);
        }

        Double maxDuration = request.getMaxDurationSeconds();
        if (maxDuration == null && isWebcam) {
            maxDuration = DEFAULT_WEBCAM_SECONDS;
        }
        Integer maxSampled = request.getMaxSampledFrames();

        long startTime = System.currentTimeMillis();
        long framesRead = 0;
        int framesSampled = 0;
        int facesDetected = 0;
        double sourceFps;

        pipelineService.startSession(sessionId);
        Optional<SessionSummary> summary;
        try (FrameGrabber grabber = createGrabber(videoSource, isWebcam);
             Java2DFrameConverter converter = new Java2DFrameConverter()) {

            grabber.start();
            sourceFps = grabber.getFrameRate();
            FrameSampler sampler = new FrameSampler(sourceFps, properties.getFps());
            log.info("视频帧率: {}, 分辨率: {}x{}, 抽帧间隔: {}",
                    sourceFps, grabber.getImageWidth(), grabber.getImageHeight(),
                    String.format("%.2f", sampler.getStep()));

            Frame frame;
            while ((frame = grabber.grab()) != null) {
                if (frame.image == null) {
                    continue;
                }
                long frameIndex = framesRead++;
                double timestamp = sampler.timestampOf(frameIndex);
                if (maxDuration != null && timestamp > maxDuration) {
                    break;
                }
                if (!sampler.shouldSample(frameIndex)) {
                    continue;
                }

                BufferedImage image = converter.convert(frame);
                if (image == null) {
                    continue;
                }
                FrameAnalysis analysis = pipelineService.processFrame(
                        sessionId, FrameImages.fromBufferedImage(image), timestamp);
                framesSampled++;
                if (analysis.isFaceDetected()) {
                    facesDetected++;
                }
                if (maxSampled != null && framesSampled >= maxSampled) {
                    break;
                }
            }
            grabber.stop();
        } finally {
            summary = pipelineService.stopSession(sessionId);
            pipelineService.discardSession(sessionId);
        }

        long processingTime = System.currentTimeMillis() - startTime;
        log.info("✓ 视频情绪分析完成: 读取 {} 帧, 采样 {} 帧, 检测到人脸 {} 帧, 耗时 {}ms",
                framesRead, framesSampled, facesDetected, processingTime);

        return VideoAnalysisResult.builder()
                .success(true)
                .message(summary.isPresent() ? "视频情绪分析完成" : "视频中未检测到人脸")
                .videoSource(videoSource)
                .sessionId(sessionId)
                .sourceFps(sourceFps)
                .framesRead(framesRead)
                .framesSampled(framesSampled)
                .facesDetected(facesDetected)
                .processingTimeMs(processingTime)
                .summary(summary.orElse(null))
                .build();
    }

    /**
     * 数字视频源按摄像头设备号打开（OpenCV VideoCapture），其余按文件路径交给FFmpeg
     */
    protected FrameGrabber createGrabber(String videoSource, boolean isWebcam) {
        if (isWebcam) {
            return new OpenCVFrameGrabber(Integer.parseInt(videoSource));
        }
        return new FFmpegFrameGrabber(videoSource);
    }
}
