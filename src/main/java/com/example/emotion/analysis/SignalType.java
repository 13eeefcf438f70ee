package com.example.emotion.analysis;

/**
 * 几何微表情指标
 */
public enum SignalType {
    EYEBROW_RAISE("eyebrow_raise"),
    LIP_PRESS("lip_press"),
    BLINK_RATE("blink_rate"),
    EYE_WIDENING("eye_widening"),
    JAW_TENSION("jaw_tension"),
    MICRO_SMILE("micro_smile");

    private final String key;

    SignalType(String key) {
        this.key = key;
    }

    /** JSON输出中的字段名 */
    public String getKey() {
        return key;
    }
}
