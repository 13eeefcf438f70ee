package com.example.emotion.landmark;

import lombok.Value;

/**
 * 单个面部关键点，x/y为像素坐标，z为相对深度
 */
@Value
public class LandmarkPoint {
    double x;
    double y;
    double z;

    /**
     * 图像平面内的欧氏距离，忽略深度
     */
    public double distanceTo(LandmarkPoint other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    public LandmarkPoint midpoint(LandmarkPoint other) {
        return new LandmarkPoint((x + other.x) / 2, (y + other.y) / 2, (z + other.z) / 2);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
