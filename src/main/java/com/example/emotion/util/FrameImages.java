package com.example.emotion.util;

import com.example.emotion.dto.FrameImage;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * BufferedImage 与 {@link FrameImage} 之间的转换
 */
public final class FrameImages {

    private FrameImages() {
    }

    /**
     * 转为紧密排列的BGR帧；非 TYPE_3BYTE_BGR 的图像先重绘
     */
    public static FrameImage fromBufferedImage(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("图像不能为空");
        }
        BufferedImage bgr = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = bgr.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        byte[] pixels = new byte[bgr.getWidth() * bgr.getHeight() * FrameImage.CHANNELS];
        System.arraycopy(data, 0, pixels, 0, pixels.length);
        return new FrameImage(bgr.getWidth(), bgr.getHeight(), pixels);
    }
}
