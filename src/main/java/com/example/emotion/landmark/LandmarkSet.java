package com.example.emotion.landmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一帧的完整关键点集合
 * <p>
 * 点数必须与方案一致：要么完整（检测到人脸），要么不存在（由 {@code Optional.empty()} 表示）。
 */
public final class LandmarkSet {

    private final LandmarkScheme scheme;
    private final List<LandmarkPoint> points;

    public LandmarkSet(LandmarkScheme scheme, List<LandmarkPoint> points) {
        if (scheme == null) {
            throw new IllegalArgumentException("关键点方案不能为空");
        }
        if (points == null || points.size() != scheme.getPointCount()) {
            throw new IllegalArgumentException(String.format("方案 %s 需要 %d 个关键点，实际为 %s",
                    scheme.getName(), scheme.getPointCount(), points == null ? "null" : points.size()));
        }
        for (LandmarkPoint point : points) {
            if (point == null) {
                throw new IllegalArgumentException("关键点集合中存在空元素");
            }
        }
        this.scheme = scheme;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public LandmarkScheme getScheme() {
        return scheme;
    }

    public int size() {
        return points.size();
    }

    public LandmarkPoint get(int index) {
        return points.get(index);
    }

    /**
     * 按命名点取坐标；方案未定义或坐标非有限值时抛出 {@link MissingLandmarkException}
     */
    public LandmarkPoint point(FacePoint facePoint) {
        LandmarkPoint point = points.get(scheme.indexOf(facePoint));
        if (!point.isFinite()) {
            throw new MissingLandmarkException("关键点 " + facePoint + " 坐标无效: " + point);
        }
        return point;
    }
}
