package com.example.journey.pipeline;

import com.example.journey.model.Line;
import com.example.journey.model.Zone;
import lombok.Value;

import java.util.List;

/**
 * 某一时刻的场景配置（出入线、区域、参数），不可变
 */
@Value
public class SceneSnapshot {

    List<Line> lines;

    List<Zone> zones;

    TrackingSettings settings;
}
