package com.example.emotion.controller;

import com.example.emotion.analysis.FusionEngine;
import com.example.emotion.analysis.MicroSignalAnalyzer;
import com.example.emotion.classifier.EmotionClassifier;
import com.example.emotion.classifier.StubEmotionClassifier;
import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.dto.SessionSummary;
import com.example.emotion.landmark.LandmarkExtractor;
import com.example.emotion.landmark.StubLandmarkExtractor;
import com.example.emotion.landmark.SyntheticFaces;
import com.example.emotion.service.EmotionRecordService;
import com.example.emotion.service.VideoEmotionAnalysisService;
import com.example.emotion.service.impl.EmotionPipelineServiceImpl;
import com.example.emotion.session.SessionRegistry;
import org.apache.commons.codec.binary.Base64;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EmotionTrackingControllerTest {

    /** 宽4像素的帧有人脸，其余没有 */
    private static final int FACE_WIDTH = 4;

    private WebTestClient client;
    private EmotionRecordService recordService;

    @Before
    public void setUp() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        LandmarkExtractor extractor = new StubLandmarkExtractor(image -> image.getWidth() == FACE_WIDTH
                ? Optional.of(SyntheticFaces.neutral().build())
                : Optional.empty());
        EmotionClassifier classifier = new StubEmotionClassifier(image -> Optional.empty());
        EmotionPipelineServiceImpl pipelineService = new EmotionPipelineServiceImpl(new SessionRegistry(properties),
                extractor, classifier, new MicroSignalAnalyzer(properties), new FusionEngine(properties), properties);

        recordService = mock(EmotionRecordService.class);
        when(recordService.saveSummary(any(SessionSummary.class), any(LocalDateTime.class))).thenReturn(Mono.empty());

        EmotionTrackingController trackingController = new EmotionTrackingController(pipelineService,
                new VideoEmotionAnalysisService(pipelineService, properties), recordService, properties);
        PipelineStatusController statusController =
                new PipelineStatusController(extractor, classifier, pipelineService, properties);
        client = WebTestClient.bindToController(trackingController, statusController).build();
    }

    @Test
    public void testSessionLifecycle() throws IOException {
        client.post().uri("/api/emotion/session/s1/start")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.session_id").isEqualTo("s1")
                .jsonPath("$.fps").isEqualTo(7.0);

        client.get().uri("/api/emotion/session/s1/summary")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);

        postFrame("s1", frame(FACE_WIDTH), 0.5)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.result.face_detected").isEqualTo(true)
                .jsonPath("$.result.emotion_analysis.dominant_emotion").isEqualTo("neutral")
                .jsonPath("$.result.timestamp").isEqualTo(0.5);

        postFrame("s1", frame(2), 1.0)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.face_detected").isEqualTo(false)
                .jsonPath("$.result.error").isEqualTo("No face detected");

        client.get().uri("/api/emotion/session/s1/summary")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.summary.total_frames_analyzed").isEqualTo(1)
                .jsonPath("$.summary.frame_count").isEqualTo(2)
                .jsonPath("$.summary.predominant_emotion").isEqualTo("neutral");

        client.get().uri("/api/emotion/session/s1/recent")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.recent.length()").isEqualTo(1);

        client.post().uri("/api/emotion/session/s1/stop")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_frames").isEqualTo(2)
                .jsonPath("$.summary.session_id").isEqualTo("s1");

        verify(recordService, times(1)).saveSummary(any(SessionSummary.class), any(LocalDateTime.class));

        postFrame("s1", frame(FACE_WIDTH), 2.0)
                .expectStatus().isNotFound();
    }

    @Test
    public void testDoubleStartConflict() {
        client.post().uri("/api/emotion/session/s1/start").exchange().expectStatus().isOk();

        client.post().uri("/api/emotion/session/s1/start")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);
    }

    @Test
    public void testFrameForUnknownSession() throws IOException {
        postFrame("missing", frame(FACE_WIDTH), 0.0)
                .expectStatus().isNotFound();
    }

    @Test
    public void testInvalidFramePayload() {
        client.post().uri("/api/emotion/session/s1/start").exchange().expectStatus().isOk();

        Map<String, Object> body = new HashMap<>();
        body.put("frame", "!!!");
        client.post().uri("/api/emotion/session/s1/frame")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);
    }

    @Test
    public void testStopWithoutFaceFrames() {
        client.post().uri("/api/emotion/session/s1/start").exchange().expectStatus().isOk();

        client.post().uri("/api/emotion/session/s1/stop")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total_frames").isEqualTo(0)
                .jsonPath("$.summary").doesNotExist();

        verify(recordService, times(0)).saveSummary(any(SessionSummary.class), any(LocalDateTime.class));
    }

    @Test
    public void testSingleFrameAnalysis() throws IOException {
        Map<String, Object> body = new HashMap<>();
        body.put("frame", "data:image/png;base64," + frame(FACE_WIDTH));

        client.post().uri("/api/emotion/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result.face_detected").isEqualTo(true)
                .jsonPath("$.result.composite_scores.engagement_score").isEqualTo(0.7);
    }

    @Test
    public void testVideoAnalysisOfMissingFile() {
        Map<String, Object> body = new HashMap<>();
        body.put("videoSource", "/no/such/video.mp4");

        client.post().uri("/api/emotion/video/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.result.error").exists();
    }

    @Test
    public void testPipelineStatus() {
        client.post().uri("/api/emotion/session/a/start").exchange().expectStatus().isOk();

        client.get().uri("/api/emotion/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("RUNNING")
                .jsonPath("$.models.landmarks.available").isEqualTo(true)
                .jsonPath("$.active_sessions").isEqualTo(1)
                .jsonPath("$.config.blink_window").isEqualTo(30);
    }

    private WebTestClient.ResponseSpec postFrame(String sessionId, String frame, double timestamp) {
        Map<String, Object> body = new HashMap<>();
        body.put("frame", frame);
        body.put("timestamp", timestamp);
        return client.post().uri("/api/emotion/session/{id}/frame", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private static String frame(int width) throws IOException {
        BufferedImage image = new BufferedImage(width, 4, BufferedImage.TYPE_3BYTE_BGR);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return Base64.encodeBase64String(out.toByteArray());
    }
}
