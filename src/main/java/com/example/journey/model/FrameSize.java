package com.example.journey.model;

import lombok.Value;

/**
 * 帧尺寸
 */
@Value
public class FrameSize {

    int width;

    int height;
}
