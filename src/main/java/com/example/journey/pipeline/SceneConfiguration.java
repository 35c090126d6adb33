package com.example.journey.pipeline;

import com.example.journey.config.JourneyProperties;
import com.example.journey.model.Line;
import com.example.journey.model.Zone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 运行期场景配置
 * <p>
 * HTTP线程写入，工作线程在每帧开始时通过 {@link #snapshot()} 读取，修改在下一帧生效，无需重启。
 */
@Slf4j
@Component
public class SceneConfiguration {

    private final List<Line> lines = new ArrayList<>();

    /** 区域按名称唯一 */
    private final Map<String, Zone> zones = new LinkedHashMap<>();

    private TrackingSettings settings;

    public SceneConfiguration(JourneyProperties properties) {
        this.settings = TrackingSettings.from(properties);
    }

    public synchronized SceneSnapshot snapshot() {
        return new SceneSnapshot(List.copyOf(lines), List.copyOf(zones.values()), settings);
    }

    // 出入线

    public synchronized List<Line> lines() {
        return List.copyOf(lines);
    }

    /**
     * 追加一条线，已存在的相同线忽略
     */
    public synchronized List<Line> addLine(Line line) {
        if (!lines.contains(line)) {
            lines.add(line);
            log.info("➕ 添加出入线 #{}: {}", lines.size() - 1, line);
        }
        return List.copyOf(lines);
    }

    public synchronized List<Line> replaceLines(List<Line> newLines) {
        lines.clear();
        lines.addAll(newLines);
        log.info("🔁 设置出入线 {} 条", lines.size());
        return List.copyOf(lines);
    }

    /**
     * 按序号删除，序号越界时不做修改
     *
     * @return 是否删除
     */
    public synchronized boolean removeLine(int index) {
        if (index < 0 || index >= lines.size()) {
            return false;
        }
        Line removed = lines.remove(index);
        log.info("➖ 删除出入线 #{}: {}", index, removed);
        return true;
    }

    // 区域

    public synchronized List<Zone> zones() {
        return List.copyOf(zones.values());
    }

    public synchronized Optional<Zone> zone(String name) {
        return Optional.ofNullable(zones.get(name));
    }

    /**
     * 添加区域，同名区域被替换
     */
    public synchronized List<Zone> putZone(Zone zone) {
        Zone previous = zones.put(zone.getName(), zone);
        if (previous != null) {
            log.info("🔁 替换区域: {}", zone.getName());
        } else {
            log.info("➕ 添加区域: {}", zone.getName());
        }
        return List.copyOf(zones.values());
    }

    public synchronized boolean removeZone(String name) {
        boolean removed = zones.remove(name) != null;
        if (removed) {
            log.info("➖ 删除区域: {}", name);
        }
        return removed;
    }

    // 参数

    public synchronized TrackingSettings settings() {
        return settings;
    }

    public synchronized TrackingSettings updateSettings(UnaryOperator<TrackingSettings> change) {
        TrackingSettings updated = change.apply(settings).validate();
        this.settings = updated;
        log.info("⚙️ 更新参数: {}", updated);
        return updated;
    }
}
