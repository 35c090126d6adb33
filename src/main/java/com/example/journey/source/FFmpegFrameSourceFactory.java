package com.example.journey.source;

import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.springframework.stereotype.Component;

/**
 * 打开视频源：摄像头设备号、网络流或本地文件
 */
@Slf4j
@Component
public class FFmpegFrameSourceFactory implements FrameSourceFactory {

    @Override
    public FrameSource open(String source) throws FrameSourceException {
        if (source == null || source.isBlank()) {
            throw new FrameSourceException("视频源不能为空");
        }
        String videoSource = source.trim();
        FFmpegFrameGrabber grabber = createGrabber(videoSource);
        try {
            grabber.start();
        } catch (Exception e) {
            try {
                grabber.close();
            } catch (Exception closeError) {
                log.warn("关闭视频源失败: {}", closeError.getMessage());
            }
            throw new FrameSourceException("无法打开视频源: " + videoSource + " (" + e.getMessage() + ")", e);
        }

        log.info("📹 流信息: {}x{}, FPS: {} [{}]", grabber.getImageWidth(), grabber.getImageHeight(),
                grabber.getFrameRate(), videoSource);
        return new FFmpegFrameSource(grabber, videoSource);
    }

    private FFmpegFrameGrabber createGrabber(String videoSource) {
        FFmpegFrameGrabber grabber;

        if (videoSource.matches("\\d+")) {
            // 摄像头设备
            String device = "/dev/video" + videoSource;
            grabber = new FFmpegFrameGrabber(device);
            grabber.setFormat("video4linux2");
            log.info("📷 使用摄像头设备: {}", device);
        } else if (isNetworkStream(videoSource)) {
            grabber = new FFmpegFrameGrabber(videoSource);

            if (videoSource.startsWith("rtsp://")) {
                grabber.setOption("rtsp_transport", "tcp");
                grabber.setOption("buffer_size", "1024000");
            }

            grabber.setOption("reconnect", "1");
            grabber.setOption("reconnect_streamed", "1");
            grabber.setOption("reconnect_delay_max", "5");

            log.info("🌐 使用网络视频流: {}", videoSource);
        } else {
            grabber = new FFmpegFrameGrabber(videoSource);
            log.info("📁 使用本地视频文件: {}", videoSource);
        }

        return grabber;
    }

    static boolean isNetworkStream(String videoSource) {
        return videoSource.startsWith("rtsp://") || videoSource.startsWith("rtmp://")
                || videoSource.startsWith("http://") || videoSource.startsWith("https://")
                || videoSource.startsWith("udp://");
    }
}
