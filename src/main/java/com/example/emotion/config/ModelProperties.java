package com.example.emotion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 模型资源路径。未启用时管线使用不可用适配器，所有帧报告为无人脸
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "emotion.models")
public class ModelProperties {

    private boolean enabled = false;

    /** OpenCV Haar人脸检测模型 */
    private String cascadePath = "models/haarcascade_frontalface_default.xml";

    /** Facemark LBF 68点模型 */
    private String facemarkModelPath = "models/lbfmodel.yaml";

    /** FER+ ONNX情绪分类模型 */
    private String classifierModelPath = "models/emotion-ferplus-8.onnx";

    /** 每种模型的原生实例数，即可并行推理的会话数 */
    private int poolSize = 4;
}
