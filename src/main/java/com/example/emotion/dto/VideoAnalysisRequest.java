package com.example.emotion.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Positive;

/**
 * 视频情绪分析请求DTO
 */
@Data
public class VideoAnalysisRequest {

    /** 视频文件路径，纯数字视为摄像头设备号 */
    @NotBlank(message = "视频源路径不能为空")
    private String videoSource;

    /** 会话ID，缺省时自动生成 */
    private String sessionId;

    /** 最多采样帧数 */
    @Positive(message = "最大采样帧数必须大于0")
    private Integer maxSampledFrames;

    /** 最长处理的视频时长（秒），摄像头默认60秒 */
    @Positive(message = "最长时长必须大于0")
    private Double maxDurationSeconds;
}
