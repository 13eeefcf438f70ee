package com.example.emotion.dto;

import lombok.Getter;

/**
 * 已解码的视频帧，像素按BGR顺序紧密排列（每像素3字节）。不可变，像素缓冲区进出都复制
 */
public final class FrameImage {

    public static final int CHANNELS = 3;

    @Getter
    private final int width;
    @Getter
    private final int height;
    private final byte[] bgr;

    public FrameImage(int width, int height, byte[] bgr) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(String.format("无效的图像尺寸: %dx%d", width, height));
        }
        if (bgr == null || bgr.length != width * height * CHANNELS) {
            throw new IllegalArgumentException(String.format("像素缓冲区长度与尺寸 %dx%d 不匹配", width, height));
        }
        this.width = width;
        this.height = height;
        this.bgr = bgr.clone();
    }

    public byte[] getBgr() {
        return bgr.clone();
    }
}
