package com.example.emotion.util;

import com.example.emotion.dto.FrameImage;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RectVector;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

/**
 * FrameImage 与 OpenCV Mat 之间的转换
 */
public final class OpenCvFrames {

    private OpenCvFrames() {
    }

    /**
     * 复制像素到新的 8UC3 Mat，调用方负责关闭
     */
    public static Mat toMat(FrameImage image) {
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CV_8UC3);
        mat.data().put(image.getBgr());
        return mat;
    }

    /**
     * 返回面积最大的人脸框下标，没有人脸时返回-1
     */
    public static int largestFace(RectVector faces) {
        int best = -1;
        long bestArea = -1;
        for (int i = 0; i < faces.size(); i++) {
            Rect face = faces.get(i);
            long area = (long) face.width() * face.height();
            if (area > bestArea) {
                bestArea = area;
                best = i;
            }
        }
        return best;
    }
}
