package com.example.journey.source;

import com.example.journey.model.FrameSize;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameGrabber;
import org.bytedeco.javacv.Java2DFrameConverter;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * 基于 JavaCV FFmpegFrameGrabber 的视频源
 */
@Slf4j
public class FFmpegFrameSource implements FrameSource {

    private final FFmpegFrameGrabber grabber;
    private final Java2DFrameConverter frameConverter = new Java2DFrameConverter();
    private final String description;
    private final FrameSize size;

    FFmpegFrameSource(FFmpegFrameGrabber grabber, String description) {
        this.grabber = grabber;
        this.description = description;
        this.size = new FrameSize(grabber.getImageWidth(), grabber.getImageHeight());
    }

    @Override
    public Optional<BufferedImage> read() throws FrameSourceException {
        try {
            Frame frame;
            while ((frame = grabber.grabImage()) != null) {
                if (frame.image == null) continue;
                BufferedImage image = frameConverter.convert(frame);
                if (image != null) {
                    return Optional.of(copy(image));
                }
            }
            return Optional.empty();
        } catch (FrameGrabber.Exception e) {
            throw new FrameSourceException("读取视频帧失败: " + description, e);
        }
    }

    @Override
    public FrameSize size() {
        return size;
    }

    @Override
    public double frameRate() {
        return grabber.getFrameRate();
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public void close() {
        try {
            grabber.close();
        } catch (Exception e) {
            log.warn("关闭视频源失败: {}", e.getMessage());
        }
    }

    /**
     * 转换器会复用同一个BufferedImage，标注前先复制
     */
    private static BufferedImage copy(BufferedImage source) {
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g2d = copy.createGraphics();
        g2d.drawImage(source, 0, 0, null);
        g2d.dispose();
        return copy;
    }
}
