package com.example.journey.geometry;

import com.example.journey.model.Point;
import com.example.journey.model.Zone;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 区域驻留跟踪：按轨迹记录当前所在区域集合，与上一帧比较得到进出事件
 */
@Slf4j
public class ZonePresenceTracker {

    private final Map<Integer, Set<String>> membership = new HashMap<>();

    public ZoneTransition update(int trackId, Point point, List<Zone> zones) {
        Set<String> current = new LinkedHashSet<>();
        for (Zone zone : zones) {
            if (zone.contains(point)) {
                current.add(zone.getName());
            }
        }

        Set<String> previous = membership.getOrDefault(trackId, Set.of());
        if (current.isEmpty() && previous.isEmpty()) {
            return ZoneTransition.none();
        }

        List<String> entered = new ArrayList<>();
        for (String name : current) {
            if (!previous.contains(name)) entered.add(name);
        }
        List<String> exited = new ArrayList<>();
        for (String name : previous) {
            if (!current.contains(name)) exited.add(name);
        }

        if (current.isEmpty()) {
            membership.remove(trackId);
        } else {
            membership.put(trackId, current);
        }

        if (!entered.isEmpty() || !exited.isEmpty()) {
            log.debug("轨迹 #{} 区域变化: 进入{} 离开{}", trackId, entered, exited);
        }
        return new ZoneTransition(List.copyOf(entered), List.copyOf(exited));
    }

    /**
     * 轨迹当前所在区域
     */
    public Set<String> zonesOf(int trackId) {
        return Set.copyOf(membership.getOrDefault(trackId, Set.of()));
    }

    public void retainTracks(Collection<Integer> liveTrackIds) {
        membership.keySet().retainAll(liveTrackIds);
    }
}
