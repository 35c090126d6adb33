package com.example.journey.tracking;

import com.example.journey.model.BoundingBox;
import com.example.journey.model.Detection;
import com.example.journey.model.FrameSize;
import com.example.journey.model.Track;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于IoU的贪心多目标跟踪器
 * <p>
 * 每帧按IoU从高到低贪心匹配检测框与已有轨迹，未匹配的检测创建新轨迹，
 * 连续 {@code maxAge} 帧未匹配的轨迹被移除。IoU相同时轨迹ID小者优先，其次检测序号小者优先。
 */
@Slf4j
public class FrameTracker {

    public static final double DEFAULT_IOU_THRESHOLD = 0.3;
    public static final int DEFAULT_MAX_AGE = 15;

    private static final float[] NEUTRAL_EMBEDDING = new float[0];

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble((Candidate c) -> c.iou).reversed()
            .thenComparingInt(c -> c.trackId)
            .thenComparingInt(c -> c.detectionIndex);

    /** 按ID递增顺序保存存活轨迹 */
    private final Map<Integer, TrackerInfo> trackers = new LinkedHashMap<>();

    private int nextTrackId = 1;

    @Getter
    private double iouThreshold;

    @Getter
    private int maxAge;

    public FrameTracker() {
        this(DEFAULT_IOU_THRESHOLD, DEFAULT_MAX_AGE);
    }

    public FrameTracker(double iouThreshold, int maxAge) {
        configure(iouThreshold, maxAge);
    }

    public void configure(double iouThreshold, int maxAge) {
        if (iouThreshold <= 0 || iouThreshold > 1) {
            throw new IllegalArgumentException("IoU阈值必须在(0,1]之间: " + iouThreshold);
        }
        if (maxAge < 0) {
            throw new IllegalArgumentException("maxAge不能为负数: " + maxAge);
        }
        this.iouThreshold = iouThreshold;
        this.maxAge = maxAge;
    }

    /**
     * 用本帧检测结果更新跟踪器
     *
     * @param detections 本帧检测
     * @param embeddings 与检测一一对应的外观特征
     * @param frameSize  帧尺寸，为null时不裁剪
     * @return 本帧存活的轨迹
     */
    public List<Track> update(List<Detection> detections, List<float[]> embeddings, FrameSize frameSize) {
        if (detections.size() != embeddings.size()) {
            throw new IllegalArgumentException(String.format(
                    "检测数量(%d)与特征数量(%d)不一致", detections.size(), embeddings.size()));
        }

        List<BoundingBox> boxes = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            boxes.add(detection.getBox().clip(frameSize));
        }

        for (TrackerInfo info : trackers.values()) {
            info.age++;
            info.lostFrames++;
        }

        // 贪心匹配
        List<Candidate> candidates = new ArrayList<>();
        for (TrackerInfo info : trackers.values()) {
            for (int di = 0; di < boxes.size(); di++) {
                candidates.add(new Candidate(info.id, di, info.lastBbox.iou(boxes.get(di))));
            }
        }
        candidates.sort(CANDIDATE_ORDER);

        boolean[] claimed = new boolean[boxes.size()];
        Set<Integer> matched = new HashSet<>();
        for (Candidate candidate : candidates) {
            if (candidate.iou < iouThreshold) {
                break;
            }
            if (matched.contains(candidate.trackId) || claimed[candidate.detectionIndex]) {
                continue;
            }
            TrackerInfo info = trackers.get(candidate.trackId);
            info.lastBbox = boxes.get(candidate.detectionIndex);
            info.lostFrames = 0;
            matched.add(candidate.trackId);
            claimed[candidate.detectionIndex] = true;
        }

        for (int di = 0; di < boxes.size(); di++) {
            if (claimed[di]) continue;
            int trackId = nextTrackId++;
            trackers.put(trackId, new TrackerInfo(trackId, boxes.get(di)));
            log.debug("创建新轨迹 #{}", trackId);
        }

        Iterator<TrackerInfo> iterator = trackers.values().iterator();
        while (iterator.hasNext()) {
            TrackerInfo info = iterator.next();
            if (info.lostFrames > maxAge) {
                iterator.remove();
                log.debug("移除轨迹 #{} - 存活{}帧, 丢失{}帧", info.id, info.age, info.lostFrames);
            }
        }

        List<Track> tracks = new ArrayList<>(trackers.size());
        for (TrackerInfo info : trackers.values()) {
            int best = -1;
            double bestIou = 0.0;
            for (int di = 0; di < boxes.size(); di++) {
                double iou = info.lastBbox.iou(boxes.get(di));
                if (iou > bestIou) {
                    bestIou = iou;
                    best = di;
                }
            }

            if (best >= 0) {
                tracks.add(new Track(info.id, info.lastBbox,
                        detections.get(best).getConfidence(), embeddings.get(best)));
            } else {
                tracks.add(new Track(info.id, info.lastBbox, 1.0, NEUTRAL_EMBEDDING));
            }
        }
        return tracks;
    }

    /**
     * 当前存活的轨迹ID
     */
    public Set<Integer> liveTrackIds() {
        return Set.copyOf(trackers.keySet());
    }

    public int size() {
        return trackers.size();
    }

    /**
     * 跟踪器信息类
     */
    private static class TrackerInfo {
        private final int id;
        private BoundingBox lastBbox;
        private int age;
        private int lostFrames;

        TrackerInfo(int id, BoundingBox bbox) {
            this.id = id;
            this.lastBbox = bbox;
            this.age = 1;
            this.lostFrames = 0;
        }
    }

    private static class Candidate {
        private final int trackId;
        private final int detectionIndex;
        private final double iou;

        Candidate(int trackId, int detectionIndex, double iou) {
            this.trackId = trackId;
            this.detectionIndex = detectionIndex;
            this.iou = iou;
        }
    }
}
