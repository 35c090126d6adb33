package com.example.journey.inference;

import com.example.journey.model.BoundingBox;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * 帧图像工具：裁剪与JPEG编码
 */
public final class FrameImages {

    private FrameImages() {
    }

    /**
     * 按边界框裁剪，框与图像无交集或面积为0时为空
     */
    public static Optional<BufferedImage> crop(BufferedImage image, BoundingBox box) {
        if (image == null || box == null) {
            return Optional.empty();
        }
        int x1 = Math.max(0, (int) Math.floor(box.getX1()));
        int y1 = Math.max(0, (int) Math.floor(box.getY1()));
        int x2 = Math.min(image.getWidth(), (int) Math.ceil(box.getX2()));
        int y2 = Math.min(image.getHeight(), (int) Math.ceil(box.getY2()));
        if (x2 <= x1 || y2 <= y1) {
            return Optional.empty();
        }
        return Optional.of(image.getSubimage(x1, y1, x2 - x1, y2 - y1));
    }

    public static byte[] toJpeg(BufferedImage image) {
        BufferedImage rgb = image;
        if (image.getColorModel().hasAlpha()) {
            rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g2d = rgb.createGraphics();
            g2d.drawImage(image, 0, 0, null);
            g2d.dispose();
        }
        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            if (!ImageIO.write(rgb, "jpg", baos)) {
                throw new IOException("没有可用的JPEG编码器");
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("JPEG编码失败", e);
        }
    }
}
