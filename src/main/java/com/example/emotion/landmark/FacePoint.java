package com.example.emotion.landmark;

/**
 * 几何分析用到的解剖学命名点，具体索引由 {@link LandmarkScheme} 决定
 */
public enum FacePoint {
    FOREHEAD_TOP,
    CHIN,

    LEFT_BROW_TOP,
    RIGHT_BROW_TOP,
    LEFT_EYE_TOP,
    RIGHT_EYE_TOP,

    // 左眼六点EAR轮廓
    LEFT_EYE_OUTER,
    LEFT_EYE_UPPER_OUTER,
    LEFT_EYE_UPPER_INNER,
    LEFT_EYE_INNER,
    LEFT_EYE_LOWER_INNER,
    LEFT_EYE_LOWER_OUTER,
    RIGHT_EYE_OUTER,

    UPPER_LIP_CENTER,
    UPPER_LIP_INNER,
    LOWER_LIP_INNER,
    MOUTH_LEFT_CORNER,
    MOUTH_RIGHT_CORNER,

    LEFT_JAW,
    RIGHT_JAW
}
