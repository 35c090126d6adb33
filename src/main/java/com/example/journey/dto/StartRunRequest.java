package com.example.journey.dto;

import lombok.Data;

@Data
public class StartRunRequest {

    /**
     * 视频源：摄像头设备号、网络流地址或本地视频文件
     * 例如: "0" (摄像头), "rtsp://example.com/stream", "/data/store.mp4"
     */
    private String source;
}
