package com.example.emotion.util;

import com.example.emotion.dto.FrameImage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * 解码前端上传的base64帧（可带 data:image/...;base64, 前缀）
 */
@Slf4j
public final class FrameImageDecoder {

    private static final String DATA_URL_SEPARATOR = ",";

    private FrameImageDecoder() {
    }

    /**
     * @throws IllegalArgumentException 内容为空、不是合法base64或不是可识别的图片格式
     */
    public static FrameImage decode(String payload) {
        if (payload == null || payload.trim().isEmpty()) {
            throw new IllegalArgumentException("帧数据不能为空");
        }
        String data = payload.trim();
        if (data.startsWith("data:")) {
            int separator = data.indexOf(DATA_URL_SEPARATOR);
            if (separator < 0) {
                throw new IllegalArgumentException("无效的data URL");
            }
            data = data.substring(separator + 1);
        }
        if (!Base64.isBase64(data)) {
            throw new IllegalArgumentException("帧数据不是合法的base64");
        }

        byte[] bytes = Base64.decodeBase64(data);
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new IllegalArgumentException("无法读取图像: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new IllegalArgumentException("不支持的图像格式");
        }
        log.debug("解码帧 {}x{}, {} 字节", image.getWidth(), image.getHeight(), bytes.length);
        return FrameImages.fromBufferedImage(image);
    }
}
