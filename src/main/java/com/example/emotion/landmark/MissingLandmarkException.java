package com.example.emotion.landmark;

/**
 * 关键点方案未定义某个命名点，或该点坐标无效
 */
public class MissingLandmarkException extends IllegalArgumentException {

    public MissingLandmarkException(String message) {
        super(message);
    }
}
