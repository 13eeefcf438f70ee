package com.example.emotion.landmark;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 构造 MediaPipe 478 点的合成人脸
 * <p>
 * 中性脸：脸高200，眉眼距12（0.06），唇间距8 / 嘴宽60，EAR 0.28，下颌高100 / 宽120，嘴角不上扬。
 */
public final class SyntheticFaces {

    private SyntheticFaces() {
    }

    public static Builder neutral() {
        return new Builder();
    }

    /** 咬紧下颌、抿唇、闭眼 */
    public static LandmarkSet tense() {
        return neutral().jawCornerY(260).lipGap(2).ear(0.1).build();
    }

    public static final class Builder {

        private final Map<FacePoint, LandmarkPoint> points = new EnumMap<>(FacePoint.class);

        private Builder() {
            points.put(FacePoint.FOREHEAD_TOP, p(200, 100));
            points.put(FacePoint.CHIN, p(200, 300));
            browGap(12);
            ear(0.28);
            points.put(FacePoint.RIGHT_EYE_OUTER, p(260, 170));
            points.put(FacePoint.MOUTH_LEFT_CORNER, p(170, 250));
            points.put(FacePoint.MOUTH_RIGHT_CORNER, p(230, 250));
            points.put(FacePoint.UPPER_LIP_CENTER, p(200, 248));
            lipGap(8);
            jawCornerY(200);
        }

        /** 眉毛顶点到上眼睑的距离（像素） */
        public Builder browGap(double gap) {
            points.put(FacePoint.LEFT_EYE_TOP, p(160, 162));
            points.put(FacePoint.RIGHT_EYE_TOP, p(240, 162));
            points.put(FacePoint.LEFT_BROW_TOP, p(160, 162 - gap));
            points.put(FacePoint.RIGHT_BROW_TOP, p(240, 162 - gap));
            return this;
        }

        /** 左眼宽40，上下眼睑对称张开 */
        public Builder ear(double ear) {
            double half = ear * 40 / 2;
            points.put(FacePoint.LEFT_EYE_OUTER, p(140, 170));
            points.put(FacePoint.LEFT_EYE_INNER, p(180, 170));
            points.put(FacePoint.LEFT_EYE_UPPER_OUTER, p(150, 170 - half));
            points.put(FacePoint.LEFT_EYE_LOWER_OUTER, p(150, 170 + half));
            points.put(FacePoint.LEFT_EYE_UPPER_INNER, p(170, 170 - half));
            points.put(FacePoint.LEFT_EYE_LOWER_INNER, p(170, 170 + half));
            return this;
        }

        public Builder lipGap(double gap) {
            points.put(FacePoint.UPPER_LIP_INNER, p(200, 254));
            points.put(FacePoint.LOWER_LIP_INNER, p(200, 254 + gap));
            return this;
        }

        /** 下颌角的纵坐标，下巴固定在300 */
        public Builder jawCornerY(double y) {
            points.put(FacePoint.LEFT_JAW, p(140, y));
            points.put(FacePoint.RIGHT_JAW, p(260, y));
            return this;
        }

        /** 嘴角相对上唇中点上扬的像素 */
        public Builder smileLift(double lift) {
            double cornerY = points.get(FacePoint.UPPER_LIP_CENTER).getY() - lift;
            points.put(FacePoint.MOUTH_LEFT_CORNER, p(170, cornerY));
            points.put(FacePoint.MOUTH_RIGHT_CORNER, p(230, cornerY));
            return this;
        }

        public Builder set(FacePoint facePoint, double x, double y) {
            points.put(facePoint, p(x, y));
            return this;
        }

        public Builder invalidate(FacePoint facePoint) {
            points.put(facePoint, new LandmarkPoint(Double.NaN, Double.NaN, 0));
            return this;
        }

        public LandmarkSet build() {
            LandmarkScheme scheme = LandmarkScheme.MEDIAPIPE_FACE_MESH;
            List<LandmarkPoint> all = new ArrayList<>(scheme.getPointCount());
            for (int i = 0; i < scheme.getPointCount(); i++) {
                all.add(p(200, 200));
            }
            points.forEach((facePoint, point) -> all.set(scheme.indexOf(facePoint), point));
            return new LandmarkSet(scheme, all);
        }

        private static LandmarkPoint p(double x, double y) {
            return new LandmarkPoint(x, y, 0);
        }
    }
}
