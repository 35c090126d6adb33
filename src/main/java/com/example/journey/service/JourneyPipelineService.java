package com.example.journey.service;

import com.example.journey.config.JourneyProperties;
import com.example.journey.dto.AnnotatedTrack;
import com.example.journey.dto.FrameSnapshot;
import com.example.journey.dto.SessionView;
import com.example.journey.inference.AppearanceEmbedder;
import com.example.journey.inference.FrameImages;
import com.example.journey.inference.PersonDetector;
import com.example.journey.model.Detection;
import com.example.journey.model.FrameSize;
import com.example.journey.pipeline.FrameResult;
import com.example.journey.pipeline.FrameSnapshotPublisher;
import com.example.journey.pipeline.JourneyPipeline;
import com.example.journey.pipeline.SceneConfiguration;
import com.example.journey.pipeline.SceneSnapshot;
import com.example.journey.render.FrameAnnotator;
import com.example.journey.source.FrameSource;
import com.example.journey.source.FrameSourceException;
import com.example.journey.source.FrameSourceFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PreDestroy;
import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 顾客动线跟踪服务
 * <p>
 * 同一时刻只有一个工作线程处理帧并写入发布槽。重新启动时先通知旧线程停止、
 * 等待其退出、清空发布状态，再启动新线程。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JourneyPipelineService {

    private static final Duration STOP_POLL_INTERVAL = Duration.ofMillis(50);

    private final FrameSourceFactory frameSourceFactory;
    private final PersonDetector personDetector;
    private final AppearanceEmbedder appearanceEmbedder;
    private final SceneConfiguration sceneConfiguration;
    private final FrameSnapshotPublisher publisher;
    private final FrameAnnotator annotator;
    private final JourneyProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.idle());
    private final AtomicReference<FrameSize> frameSize = new AtomicReference<>();

    /**
     * 启动（或重新启动）跟踪
     *
     * @param source 摄像头设备号、网络流地址或本地文件
     * @throws FrameSourceException 视频源无法打开
     */
    public synchronized RunStatus start(String source) throws FrameSourceException {
        stopAndAwait();

        publisher.reset();
        frameSize.set(null);

        FrameSource frameSource;
        try {
            frameSource = frameSourceFactory.open(source);
        } catch (FrameSourceException e) {
            status.set(RunStatus.builder()
                    .state(RunState.ERROR)
                    .source(source)
                    .endTime(clock.instant())
                    .error(e.getMessage())
                    .build());
            throw e;
        }

        frameSize.set(frameSource.size());
        stopRequested.set(false);
        running.set(true);
        RunStatus started = RunStatus.builder()
                .state(RunState.RUNNING)
                .source(source)
                .startTime(clock.instant())
                .build();
        status.set(started);

        log.info("🎬 开始处理视频流: {}", source);

        // 异步启动处理
        Mono.fromRunnable(() -> processStream(frameSource))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();

        return started;
    }

    /**
     * 请求停止，在下一帧边界生效
     */
    public void stop() {
        if (running.get()) {
            log.info("🛑 停止流跟踪: {}", status.get().getSource());
            stopRequested.set(true);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public RunStatus status() {
        return status.get();
    }

    public Optional<FrameSize> frameSize() {
        return Optional.ofNullable(frameSize.get());
    }

    /**
     * 帧快照流，每个订阅者独立等待新帧
     */
    public Flux<FrameSnapshot> snapshots() {
        Duration readerWait = properties.getStream().getReaderWait();
        AtomicReference<FrameSnapshot> lastSeen = new AtomicReference<>();
        return Mono.fromCallable(() -> publisher.awaitChange(lastSeen.get(), readerWait))
                .subscribeOn(Schedulers.boundedElastic())
                .repeat()
                .filter(Optional::isPresent)
                .map(Optional::get)
                .doOnNext(lastSeen::set);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    private void stopAndAwait() {
        if (!running.get()) {
            return;
        }
        stopRequested.set(true);
        log.info("⏳ 等待上一次运行结束: {}", status.get().getSource());
        while (running.get()) {
            try {
                Thread.sleep(STOP_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("等待上一次运行结束时被中断", e);
            }
        }
    }

    /**
     * 工作线程主循环
     */
    private void processStream(FrameSource frameSource) {
        JourneyPipeline pipeline = new JourneyPipeline(sceneConfiguration.settings());
        AtomicLong frameCounter = new AtomicLong();
        RunState endState = RunState.COMPLETED;
        String error = null;

        try (frameSource) {
            double fps = frameSource.frameRate();
            boolean pace = properties.getStream().isPaceToFrameRate() && fps > 0;

            Optional<BufferedImage> next;
            while (!stopRequested.get() && (next = frameSource.read()).isPresent()) {
                long frameStart = System.currentTimeMillis();
                long currentFrame = frameCounter.incrementAndGet();

                try {
                    processFrame(pipeline, next.get(), frameSource.size(), frameStart);
                    status.updateAndGet(s -> s.toBuilder().framesProcessed(currentFrame).build());
                } catch (Exception e) {
                    log.warn("处理帧 {} 时出错: {}", currentFrame, e.getMessage());
                }

                // 限制处理速度（避免过快）
                if (pace) {
                    long targetDelay = (long) (1000 / fps);
                    long actualDelay = System.currentTimeMillis() - frameStart;
                    if (actualDelay < targetDelay) {
                        Thread.sleep(targetDelay - actualDelay);
                    }
                }
            }
            if (stopRequested.get()) {
                endState = RunState.STOPPED;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            endState = RunState.STOPPED;
        } catch (Exception e) {
            log.error("流处理异常 [{}]: {}", frameSource.description(), e.getMessage(), e);
            endState = RunState.ERROR;
            error = e.getMessage();
        } finally {
            RunState finalState = endState;
            String finalError = error;
            status.updateAndGet(s -> s.toBuilder()
                    .state(finalState)
                    .endTime(clock.instant())
                    .error(finalError)
                    .build());
            running.set(false);
            log.info("🏁 流处理完成: {} ({}, {} 帧)", frameSource.description(), finalState, frameCounter.get());
        }
    }

    private void processFrame(JourneyPipeline pipeline, BufferedImage image, FrameSize size, long frameStart) {
        Instant now = clock.instant();
        SceneSnapshot scene = sceneConfiguration.snapshot();

        List<Detection> detections = personDetector.detect(image, scene.getSettings().getDetectionConfidence());
        List<float[]> embeddings = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            embeddings.add(FrameImages.crop(image, detection.getBox())
                    .map(appearanceEmbedder::embed)
                    .orElseGet(appearanceEmbedder::neutralVector));
        }

        FrameResult result = pipeline.process(detections, embeddings, size, scene, now);
        byte[] frameBytes = annotator.render(image, result, scene);

        publisher.publish(FrameSnapshot.builder()
                .frameNumber(result.getFrameNumber())
                .timestamp(result.getTimestamp())
                .frameWidth(size.getWidth())
                .frameHeight(size.getHeight())
                .currentPersonCount(result.getTracks().size())
                .processingTimeMs(System.currentTimeMillis() - frameStart)
                .tracks(result.getTracks().stream().map(AnnotatedTrack::from).toList())
                .activeSessionIds(result.getActiveSessions().stream().map(SessionView::getSessionId).toList())
                .sessions(result.getSessions())
                .frameJpeg(frameBytes)
                .build());
    }
}
