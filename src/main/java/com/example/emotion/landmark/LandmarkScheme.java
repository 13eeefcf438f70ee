package com.example.emotion.landmark;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 关键点索引方案：命名点到模型输出索引的查找表
 * <p>
 * 更换关键点模型时只需新增方案，几何分析逻辑保持不变。
 */
public final class LandmarkScheme {

    /** MediaPipe FaceMesh，468点 + 10个虹膜点 */
    public static final LandmarkScheme MEDIAPIPE_FACE_MESH = builder("mediapipe-face-mesh", 478)
            .map(FacePoint.FOREHEAD_TOP, 10)
            .map(FacePoint.CHIN, 152)
            .map(FacePoint.LEFT_BROW_TOP, 70)
            .map(FacePoint.RIGHT_BROW_TOP, 300)
            .map(FacePoint.LEFT_EYE_TOP, 159)
            .map(FacePoint.RIGHT_EYE_TOP, 386)
            .map(FacePoint.LEFT_EYE_OUTER, 33)
            .map(FacePoint.LEFT_EYE_UPPER_OUTER, 160)
            .map(FacePoint.LEFT_EYE_UPPER_INNER, 158)
            .map(FacePoint.LEFT_EYE_INNER, 133)
            .map(FacePoint.LEFT_EYE_LOWER_INNER, 153)
            .map(FacePoint.LEFT_EYE_LOWER_OUTER, 144)
            .map(FacePoint.RIGHT_EYE_OUTER, 263)
            .map(FacePoint.UPPER_LIP_CENTER, 0)
            .map(FacePoint.UPPER_LIP_INNER, 13)
            .map(FacePoint.LOWER_LIP_INNER, 14)
            .map(FacePoint.MOUTH_LEFT_CORNER, 61)
            .map(FacePoint.MOUTH_RIGHT_CORNER, 291)
            .map(FacePoint.LEFT_JAW, 172)
            .map(FacePoint.RIGHT_JAW, 397)
            .build();

    /**
     * iBUG 300-W 68点布局（OpenCV Facemark LBF输出）。
     * <p>
     * 没有额头点，脸高取鼻梁顶部(27)到下巴，下颌点(4/12)也比MediaPipe的172/397低。
     * 按iBUG平均脸型校准：中性脸眉眼比约0.150、下颌高宽比约0.364，
     * 分别缩放到MediaPipe中性脸的0.06与0.80，几何阈值因此可以共用。
     */
    public static final LandmarkScheme IBUG_68 = builder("ibug-68", 68)
            .map(FacePoint.FOREHEAD_TOP, 27)
            .map(FacePoint.CHIN, 8)
            .map(FacePoint.LEFT_BROW_TOP, 19)
            .map(FacePoint.RIGHT_BROW_TOP, 24)
            .map(FacePoint.LEFT_EYE_TOP, 37)
            .map(FacePoint.RIGHT_EYE_TOP, 44)
            .map(FacePoint.LEFT_EYE_OUTER, 36)
            .map(FacePoint.LEFT_EYE_UPPER_OUTER, 37)
            .map(FacePoint.LEFT_EYE_UPPER_INNER, 38)
            .map(FacePoint.LEFT_EYE_INNER, 39)
            .map(FacePoint.LEFT_EYE_LOWER_INNER, 40)
            .map(FacePoint.LEFT_EYE_LOWER_OUTER, 41)
            .map(FacePoint.RIGHT_EYE_OUTER, 45)
            .map(FacePoint.UPPER_LIP_CENTER, 51)
            .map(FacePoint.UPPER_LIP_INNER, 62)
            .map(FacePoint.LOWER_LIP_INNER, 66)
            .map(FacePoint.MOUTH_LEFT_CORNER, 48)
            .map(FacePoint.MOUTH_RIGHT_CORNER, 54)
            .map(FacePoint.LEFT_JAW, 4)
            .map(FacePoint.RIGHT_JAW, 12)
            .ratioScales(0.40, 2.2)
            .build();

    private final String name;
    private final int pointCount;
    private final Map<FacePoint, Integer> indices;
    private final double browRatioScale;
    private final double jawRatioScale;

    private LandmarkScheme(String name, int pointCount, Map<FacePoint, Integer> indices,
                           double browRatioScale, double jawRatioScale) {
        this.name = name;
        this.pointCount = pointCount;
        this.indices = Collections.unmodifiableMap(new EnumMap<>(indices));
        this.browRatioScale = browRatioScale;
        this.jawRatioScale = jawRatioScale;
    }

    public static Builder builder(String name, int pointCount) {
        return new Builder(name, pointCount);
    }

    public String getName() {
        return name;
    }

    public int getPointCount() {
        return pointCount;
    }

    /**
     * 眉眼距离/脸高 换算到阈值所用参考系（MediaPipe）的系数
     */
    public double getBrowRatioScale() {
        return browRatioScale;
    }

    /**
     * 下颌高/下颌宽 换算到阈值所用参考系（MediaPipe）的系数
     */
    public double getJawRatioScale() {
        return jawRatioScale;
    }

    public boolean defines(FacePoint point) {
        return indices.containsKey(point);
    }

    public int indexOf(FacePoint point) {
        Integer index = indices.get(point);
        if (index == null) {
            throw new MissingLandmarkException("方案 " + name + " 未定义关键点 " + point);
        }
        return index;
    }

    @Override
    public String toString() {
        return name + "(" + pointCount + ")";
    }

    public static final class Builder {
        private final String name;
        private final int pointCount;
        private final Map<FacePoint, Integer> indices = new EnumMap<>(FacePoint.class);
        private double browRatioScale = 1.0;
        private double jawRatioScale = 1.0;

        private Builder(String name, int pointCount) {
            if (pointCount <= 0) {
                throw new IllegalArgumentException("关键点数量必须大于0: " + pointCount);
            }
            this.name = name;
            this.pointCount = pointCount;
        }

        public Builder map(FacePoint point, int index) {
            if (index < 0 || index >= pointCount) {
                throw new IllegalArgumentException(String.format("%s 的索引 %d 超出范围 [0,%d)", point, index, pointCount));
            }
            indices.put(point, index);
            return this;
        }

        public Builder ratioScales(double browRatioScale, double jawRatioScale) {
            if (!(browRatioScale > 0) || !(jawRatioScale > 0)) {
                throw new IllegalArgumentException(String.format("校准系数必须大于0: brow=%s, jaw=%s",
                        browRatioScale, jawRatioScale));
            }
            this.browRatioScale = browRatioScale;
            this.jawRatioScale = jawRatioScale;
            return this;
        }

        public LandmarkScheme build() {
            return new LandmarkScheme(name, pointCount, indices, browRatioScale, jawRatioScale);
        }
    }
}
