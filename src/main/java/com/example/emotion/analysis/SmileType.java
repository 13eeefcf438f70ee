package com.example.emotion.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 微笑类型。区分 Duchenne 需要多帧眼角皱纹对比，尚未实现，检测到的微笑一律为 SOCIAL。
 */
public enum SmileType {
    DUCHENNE("duchenne"),
    SOCIAL("social"),
    NONE("none");

    private final String label;

    SmileType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
