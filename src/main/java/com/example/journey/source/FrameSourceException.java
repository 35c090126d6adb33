package com.example.journey.source;

/**
 * 视频源打开或读取失败
 */
public class FrameSourceException extends Exception {

    public FrameSourceException(String message) {
        super(message);
    }

    public FrameSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
