package com.example.journey.geometry;

import com.example.journey.model.CrossingEvent;
import com.example.journey.model.Line;
import com.example.journey.model.Point;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 有向线跨越检测
 * <p>
 * 按 (轨迹ID, 线序号) 记录上一次非零的侧别；侧别由 -1 变为 +1 为 ENTRY，+1 变为 -1 为 EXIT。
 * 同一轨迹两次事件之间至少间隔 {@code debounce}，每帧每条轨迹最多产生一个事件，按线的顺序先到先得。
 */
@Slf4j
public class CrossingDetector {

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(750);

    /** trackId -> (lineIndex -> side) */
    private final Map<Integer, Map<Integer, Integer>> lastSides = new HashMap<>();

    private final Map<Integer, Instant> lastEventAt = new HashMap<>();

    @Getter
    private List<Line> lines = List.of();

    @Getter
    private Duration debounce;

    public CrossingDetector() {
        this(DEFAULT_DEBOUNCE);
    }

    public CrossingDetector(Duration debounce) {
        setDebounce(debounce);
    }

    public void setDebounce(Duration debounce) {
        if (debounce == null || debounce.isNegative()) {
            throw new IllegalArgumentException("去抖间隔不能为负: " + debounce);
        }
        this.debounce = debounce;
    }

    /**
     * 设置本帧使用的线；某个序号上的线变化或被移除时，只清空该序号的侧别记忆（保留去抖计时）
     */
    public void setLines(List<Line> lines) {
        List<Line> next = List.copyOf(lines);
        if (next.equals(this.lines)) {
            return;
        }
        Set<Integer> changed = new HashSet<>();
        for (int i = 0; i < this.lines.size(); i++) {
            if (i >= next.size() || !this.lines.get(i).equals(next.get(i))) {
                changed.add(i);
            }
        }
        if (!changed.isEmpty() && !lastSides.isEmpty()) {
            log.debug("出入线变化({} -> {})，清空序号 {} 的侧别记忆", this.lines.size(), next.size(), changed);
            for (Map<Integer, Integer> sides : lastSides.values()) {
                sides.keySet().removeAll(changed);
            }
        }
        this.lines = next;
    }

    /**
     * 计算轨迹在本帧的跨线事件
     *
     * @param trackId 轨迹ID
     * @param point   轨迹参考点（框中心）
     * @param now     本帧时间
     */
    public Optional<CrossingEvent> evaluate(int trackId, Point point, Instant now) {
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        Map<Integer, Integer> sides = lastSides.computeIfAbsent(trackId, id -> new HashMap<>());

        CrossingEvent event = null;
        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            int current = lines.get(lineIndex).sideOf(point);
            Integer previous = sides.get(lineIndex);

            if (event == null && current != 0 && previous != null && previous != current) {
                CrossingEvent candidate = previous < current ? CrossingEvent.ENTRY : CrossingEvent.EXIT;
                if (debounceElapsed(trackId, now)) {
                    event = candidate;
                    lastEventAt.put(trackId, now);
                    log.info("🚶 轨迹 #{} 跨越第{}条线: {}", trackId, lineIndex, candidate);
                } else {
                    log.debug("轨迹 #{} 跨越第{}条线({})被去抖抑制", trackId, lineIndex, candidate);
                }
            }

            // 落在线上时保留之前的侧别
            if (current != 0) {
                sides.put(lineIndex, current);
            }
        }
        return Optional.ofNullable(event);
    }

    /**
     * 指定轨迹在某条线上记忆的侧别
     */
    public Optional<Integer> rememberedSide(int trackId, int lineIndex) {
        Map<Integer, Integer> sides = lastSides.get(trackId);
        return sides == null ? Optional.empty() : Optional.ofNullable(sides.get(lineIndex));
    }

    /**
     * 清理已过期轨迹的状态
     */
    public void retainTracks(Collection<Integer> liveTrackIds) {
        lastSides.keySet().retainAll(liveTrackIds);
        lastEventAt.keySet().retainAll(liveTrackIds);
    }

    int trackedCount() {
        return lastSides.size();
    }

    private boolean debounceElapsed(int trackId, Instant now) {
        Instant last = lastEventAt.get(trackId);
        return last == null || Duration.between(last, now).compareTo(debounce) >= 0;
    }
}
