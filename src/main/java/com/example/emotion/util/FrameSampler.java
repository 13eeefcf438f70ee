package com.example.emotion.util;

/**
 * 按目标帧率从源视频中抽帧
 * <p>
 * 源帧率未知（≤0）时每帧都采样，时间戳按目标帧率推算。
 */
public class FrameSampler {

    private final double sourceFps;
    private final double targetFps;
    private final double step;
    private double nextSample;

    public FrameSampler(double sourceFps, double targetFps) {
        if (!(targetFps > 0)) {
            throw new IllegalArgumentException("目标帧率必须大于0: " + targetFps);
        }
        this.sourceFps = sourceFps;
        this.targetFps = targetFps;
        this.step = sourceFps > targetFps ? sourceFps / targetFps : 1.0;
    }

    /**
     * @param frameIndex 从0开始的源帧序号，需单调递增
     */
    public boolean shouldSample(long frameIndex) {
        if (frameIndex + 1e-9 < nextSample) {
            return false;
        }
        while (nextSample <= frameIndex + 1e-9) {
            nextSample += step;
        }
        return true;
    }

    /**
     * 源帧对应的视频内时间（秒）
     */
    public double timestampOf(long frameIndex) {
        return sourceFps > 0 ? frameIndex / sourceFps : frameIndex / targetFps;
    }

    public double getStep() {
        return step;
    }
}
