package com.example.journey.controller;

import com.example.journey.dto.FrameSnapshot;
import com.example.journey.dto.LineRequest;
import com.example.journey.dto.SessionView;
import com.example.journey.dto.SettingsRequest;
import com.example.journey.dto.StartRunRequest;
import com.example.journey.dto.ZoneRequest;
import com.example.journey.model.Line;
import com.example.journey.model.Zone;
import com.example.journey.pipeline.FrameSnapshotPublisher;
import com.example.journey.pipeline.SceneConfiguration;
import com.example.journey.pipeline.TrackingSettings;
import com.example.journey.service.JourneyPipelineService;
import com.example.journey.service.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

@Slf4j
@RestController
@RequestMapping("/api/journey")
@RequiredArgsConstructor
@CrossOrigin(origins = "*", allowedHeaders = "*")
public class JourneyController {

    private final JourneyPipelineService pipelineService;
    private final SceneConfiguration sceneConfiguration;
    private final FrameSnapshotPublisher publisher;

    /**
     * 开始（或重新开始）跟踪
     */
    @PostMapping("/start")
    public Mono<ResponseEntity<Map<String, Object>>> start(@RequestBody StartRunRequest request) {
        return respond("启动跟踪", () -> {
            if (request.getSource() == null || request.getSource().isBlank()) {
                throw new IllegalArgumentException("视频源不能为空");
            }
            log.info("🎥 启动跟踪: {}", request.getSource());

            RunStatus status = pipelineService.start(request.getSource().trim());

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "跟踪已启动");
            response.put("status", status);
            return response;
        });
    }

    /**
     * 停止跟踪，在下一帧边界生效
     */
    @PostMapping("/stop")
    public Mono<ResponseEntity<Map<String, Object>>> stop() {
        return respond("停止跟踪", () -> {
            boolean wasRunning = pipelineService.isRunning();
            pipelineService.stop();

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", wasRunning ? "跟踪停止中" : "当前没有运行中的跟踪");
            response.put("status", pipelineService.status());
            return response;
        });
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<RunStatus>> status() {
        return Mono.fromCallable(() -> ResponseEntity.ok(pipelineService.status()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    // 出入线

    @GetMapping("/lines")
    public Mono<ResponseEntity<Map<String, Object>>> lines() {
        return respond("查询出入线", () -> linesResponse(sceneConfiguration.lines()));
    }

    /**
     * 追加一条出入线
     */
    @PostMapping("/line")
    public Mono<ResponseEntity<Map<String, Object>>> addLine(@RequestBody LineRequest request) {
        return respond("添加出入线", () -> linesResponse(sceneConfiguration.addLine(request.toLine())));
    }

    /**
     * 整体替换出入线列表
     */
    @PostMapping("/lines")
    public Mono<ResponseEntity<Map<String, Object>>> replaceLines(@RequestBody List<LineRequest> requests) {
        return respond("设置出入线", () -> {
            List<Line> lines = requests.stream().map(LineRequest::toLine).toList();
            return linesResponse(sceneConfiguration.replaceLines(lines));
        });
    }

    @DeleteMapping("/lines/{index}")
    public Mono<ResponseEntity<Map<String, Object>>> removeLine(@PathVariable int index) {
        return respond("删除出入线", () -> {
            if (!sceneConfiguration.removeLine(index)) {
                throw new NoSuchElementException("出入线不存在: " + index);
            }
            return linesResponse(sceneConfiguration.lines());
        });
    }

    // 区域

    @GetMapping("/zones")
    public Mono<ResponseEntity<Map<String, Object>>> zones() {
        return respond("查询区域", () -> zonesResponse(sceneConfiguration.zones()));
    }

    /**
     * 添加区域，同名区域被替换
     */
    @PostMapping("/zone")
    public Mono<ResponseEntity<Map<String, Object>>> putZone(@RequestBody ZoneRequest request) {
        return respond("添加区域", () -> zonesResponse(sceneConfiguration.putZone(request.toZone())));
    }

    @DeleteMapping("/zones/{name}")
    public Mono<ResponseEntity<Map<String, Object>>> removeZone(@PathVariable String name) {
        return respond("删除区域", () -> {
            if (!sceneConfiguration.removeZone(name)) {
                throw new NoSuchElementException("区域不存在: " + name);
            }
            return zonesResponse(sceneConfiguration.zones());
        });
    }

    // 参数

    @GetMapping("/settings")
    public Mono<ResponseEntity<Map<String, Object>>> settings() {
        return respond("查询参数", () -> settingsResponse(sceneConfiguration.settings()));
    }

    @PutMapping("/settings")
    public Mono<ResponseEntity<Map<String, Object>>> updateSettings(@RequestBody SettingsRequest request) {
        return respond("更新参数", () -> settingsResponse(sceneConfiguration.updateSettings(request::applyTo)));
    }

    /**
     * 帧尺寸与当前场景配置，供前端画线画区域
     */
    @GetMapping("/meta")
    public Mono<ResponseEntity<Map<String, Object>>> meta() {
        return respond("查询元数据", () -> {
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            pipelineService.frameSize().ifPresent(size -> {
                response.put("frameWidth", size.getWidth());
                response.put("frameHeight", size.getHeight());
            });
            response.put("lines", sceneConfiguration.lines().stream().map(LineRequest::from).toList());
            response.put("zones", sceneConfiguration.zones().stream().map(ZoneRequest::from).toList());
            response.put("status", pipelineService.status());
            return response;
        });
    }

    // 会话

    /**
     * 最新帧的全部会话
     */
    @GetMapping("/sessions")
    public Mono<ResponseEntity<Map<String, Object>>> sessions() {
        return respond("查询会话", () -> sessionsResponse(publisher.latest()
                .map(FrameSnapshot::getSessions)
                .orElse(List.of())));
    }

    @GetMapping("/sessions/active")
    public Mono<ResponseEntity<Map<String, Object>>> activeSessions() {
        return respond("查询活跃会话", () -> sessionsResponse(publisher.latest()
                .map(snapshot -> {
                    Set<String> active = Set.copyOf(snapshot.getActiveSessionIds());
                    return snapshot.getSessions().stream()
                            .filter(session -> active.contains(session.getSessionId()))
                            .toList();
                })
                .orElse(List.of())));
    }

    /**
     * 获取跟踪结果 (Server-Sent Events)
     */
    @GetMapping(value = "/results", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<FrameSnapshot>> results() {
        log.info("📡 客户端连接跟踪结果");

        return pipelineService.snapshots()
                .map(snapshot -> ServerSentEvent.<FrameSnapshot>builder()
                        .id(String.valueOf(snapshot.getFrameNumber()))
                        .event("frame")
                        .data(snapshot)
                        .build())
                .doOnCancel(() -> log.info("📡 客户端断开跟踪结果"))
                .doOnError(error -> log.error("📡 跟踪结果推送错误: {}", error.getMessage()));
    }

    /**
     * 获取标注后的实时帧 (MJPEG流)
     */
    @GetMapping(value = "/stream", produces = "multipart/x-mixed-replace; boundary=frame")
    public Flux<byte[]> stream() {
        log.info("📸 客户端请求实时帧");

        return pipelineService.snapshots()
                .map(FrameSnapshot::getFrameJpeg)
                .filter(Objects::nonNull)
                .doOnCancel(() -> log.info("📸 客户端断开实时帧"))
                .doOnError(error -> log.error("📸 实时帧推送错误: {}", error.getMessage()));
    }

    // 私有方法

    private Mono<ResponseEntity<Map<String, Object>>> respond(String action, Callable<Map<String, Object>> body) {
        return Mono.fromCallable(() -> ResponseEntity.ok(body.call()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> {
                    HttpStatus status = ex instanceof NoSuchElementException ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
                    log.warn("{}失败: {}", action, ex.getMessage());
                    Map<String, Object> errorResponse = new HashMap<>();
                    errorResponse.put("success", false);
                    errorResponse.put("error", ex.getMessage());
                    return Mono.just(ResponseEntity.status(status).body(errorResponse));
                });
    }

    private Map<String, Object> linesResponse(List<Line> lines) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("lines", lines.stream().map(LineRequest::from).toList());
        return response;
    }

    private Map<String, Object> zonesResponse(List<Zone> zones) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("zones", zones.stream().map(ZoneRequest::from).toList());
        return response;
    }

    private Map<String, Object> settingsResponse(TrackingSettings settings) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("detectionConfidence", settings.getDetectionConfidence());
        values.put("similarityThreshold", settings.getSimilarityThreshold());
        values.put("inactivityTimeoutMs", settings.getInactivityTimeout().toMillis());
        values.put("iouThreshold", settings.getIouThreshold());
        values.put("maxAge", settings.getMaxAge());
        values.put("crossingDebounceMs", settings.getCrossingDebounce().toMillis());

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("settings", values);
        return response;
    }

    private Map<String, Object> sessionsResponse(List<SessionView> sessions) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("count", sessions.size());
        response.put("sessions", sessions);
        return response;
    }
}
