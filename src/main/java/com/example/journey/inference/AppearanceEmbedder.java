package com.example.journey.inference;

import java.awt.image.BufferedImage;

/**
 * 外观特征提取
 * <p>
 * 空的或无效的裁剪图返回 {@link #neutralVector()}，不抛异常。
 */
public interface AppearanceEmbedder {

    float[] embed(BufferedImage crop);

    /**
     * 中性（全零）向量，与任何身份都不会匹配
     */
    float[] neutralVector();
}
