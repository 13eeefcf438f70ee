package com.example.emotion.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.PositiveOrZero;

/**
 * 实时帧请求DTO
 */
@Data
public class FrameRequest {

    /** base64图像，可带 data URL 前缀 */
    @NotBlank(message = "帧数据不能为空")
    private String frame;

    /** 会话相对时间（秒），缺省时按帧序号推算 */
    @PositiveOrZero(message = "时间戳不能为负")
    private Double timestamp;
}
