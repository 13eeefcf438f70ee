package com.example.emotion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 视频情绪分析结果DTO
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VideoAnalysisResult {

    private boolean success;

    private String error;

    private String message;

    private String videoSource;

    private String sessionId;

    /** 源视频帧率，摄像头可能为0 */
    private double sourceFps;

    /** 读取的源帧数 */
    private long framesRead;

    /** 送入管线的采样帧数 */
    private int framesSampled;

    /** 检测到人脸的采样帧数 */
    private int facesDetected;

    private long processingTimeMs;

    /** 没有检测到任何人脸时为空 */
    private SessionSummary summary;
}
