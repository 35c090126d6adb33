package com.example.journey.pipeline;

import com.example.journey.dto.SessionView;
import com.example.journey.geometry.CrossingDetector;
import com.example.journey.geometry.ZonePresenceTracker;
import com.example.journey.geometry.ZoneTransition;
import com.example.journey.identity.IdentityResolver;
import com.example.journey.model.CrossingEvent;
import com.example.journey.model.Detection;
import com.example.journey.model.FrameSize;
import com.example.journey.model.Point;
import com.example.journey.model.Track;
import com.example.journey.session.SessionStore;
import com.example.journey.tracking.FrameTracker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 单次运行的跟踪流水线
 * <p>
 * 持有跟踪器、身份识别、跨线检测、区域跟踪和会话存储，每次运行新建一个实例。
 * 只允许工作线程调用。
 */
@Slf4j
public class JourneyPipeline {

    @Getter
    private final FrameTracker tracker;

    @Getter
    private final IdentityResolver identities;

    @Getter
    private final CrossingDetector crossings;

    @Getter
    private final ZonePresenceTracker zonePresence;

    @Getter
    private final SessionStore sessions;

    private TrackingSettings appliedSettings;

    private long frameNumber;

    public JourneyPipeline(TrackingSettings settings) {
        this.tracker = new FrameTracker(settings.getIouThreshold(), settings.getMaxAge());
        this.identities = new IdentityResolver(settings.getSimilarityThreshold());
        this.crossings = new CrossingDetector(settings.getCrossingDebounce());
        this.zonePresence = new ZonePresenceTracker();
        this.sessions = new SessionStore(settings.getInactivityTimeout());
        this.appliedSettings = settings;
    }

    /**
     * 处理一帧
     *
     * @param detections 本帧检测
     * @param embeddings 与检测一一对应的外观特征
     * @param frameSize  帧尺寸
     * @param scene      本帧使用的场景配置
     * @param now        本帧时刻，帧内所有判断共用
     */
    public FrameResult process(List<Detection> detections, List<float[]> embeddings,
                               FrameSize frameSize, SceneSnapshot scene, Instant now) {
        applySettings(scene.getSettings());
        crossings.setLines(scene.getLines());
        frameNumber++;

        List<Track> tracks = tracker.update(detections, embeddings, frameSize);

        Set<Integer> live = tracker.liveTrackIds();
        identities.retainTracks(live);
        crossings.retainTracks(live);
        zonePresence.retainTracks(live);

        for (Track track : tracks) {
            int personId = identities.assignIdentity(track.getTrackId(), track.getEmbedding());
            sessions.markSeen(personId, now);

            Point center = track.getBox().center();
            Optional<CrossingEvent> event = crossings.evaluate(track.getTrackId(), center, now);
            event.ifPresent(e -> {
                if (e == CrossingEvent.ENTRY) {
                    sessions.onEntry(personId, now);
                } else {
                    sessions.onExit(personId, now);
                }
            });

            ZoneTransition transition = zonePresence.update(track.getTrackId(), center, scene.getZones());
            for (String zoneName : transition.getEntered()) {
                sessions.onZoneEntry(personId, zoneName, now);
            }
            for (String zoneName : transition.getExited()) {
                sessions.onZoneExit(personId, zoneName, now);
            }

            track.setGlobalPersonId(personId);
            track.setSessionId(sessions.sessionIdOf(personId).orElse(null));
            track.setCrossEvent(event.orElse(null));
        }

        List<SessionView> active = sessions.activeSessions(now).stream().map(SessionView::from).toList();
        List<SessionView> all = sessions.allSessions().stream().map(SessionView::from).toList();
        return new FrameResult(frameNumber, now, frameSize, List.copyOf(tracks), active, all);
    }

    public long getFrameNumber() {
        return frameNumber;
    }

    private void applySettings(TrackingSettings settings) {
        if (settings == null || settings.equals(appliedSettings)) {
            return;
        }
        tracker.configure(settings.getIouThreshold(), settings.getMaxAge());
        identities.setSimilarityThreshold(settings.getSimilarityThreshold());
        crossings.setDebounce(settings.getCrossingDebounce());
        sessions.setInactivityTimeout(settings.getInactivityTimeout());
        appliedSettings = settings;
        log.debug("流水线参数已更新: {}", settings);
    }
}
