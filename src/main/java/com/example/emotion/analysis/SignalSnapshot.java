package com.example.emotion.analysis;

import lombok.Value;

import java.util.Map;

/**
 * 单帧几何量快照，保存在会话的近期历史中
 */
@Value
public class SignalSnapshot {
    double timestamp;
    /** 眼睛纵横比，无法计算时为null */
    Double eyeAspectRatio;
    /** 可用指标的强度 */
    Map<SignalType, Double> intensities;
}
