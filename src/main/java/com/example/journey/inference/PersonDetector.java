package com.example.journey.inference;

import com.example.journey.model.Detection;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * 行人检测，只返回 person 类别
 */
public interface PersonDetector {

    List<Detection> detect(BufferedImage frame, double confidenceThreshold);
}
