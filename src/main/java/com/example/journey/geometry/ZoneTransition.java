package com.example.journey.geometry;

import lombok.Value;

import java.util.List;

/**
 * 单帧区域进出变化
 */
@Value
public class ZoneTransition {

    private static final ZoneTransition NONE = new ZoneTransition(List.of(), List.of());

    /** 本帧新进入的区域 */
    List<String> entered;

    /** 本帧离开的区域 */
    List<String> exited;

    public static ZoneTransition none() {
        return NONE;
    }

    public boolean isEmpty() {
        return entered.isEmpty() && exited.isEmpty();
    }
}
