package com.example.emotion.analysis;

/**
 * 分数裁剪工具
 */
public final class ScoreMath {

    private ScoreMath() {
    }

    /**
     * 裁剪到[0,1]，NaN按0处理
     */
    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
