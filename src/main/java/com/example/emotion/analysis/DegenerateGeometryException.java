package com.example.emotion.analysis;

/**
 * 参考距离为零或非有限值，无法做归一化
 */
public class DegenerateGeometryException extends RuntimeException {

    public DegenerateGeometryException(String message) {
        super(message);
    }
}
