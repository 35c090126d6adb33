package com.example.journey.pipeline;

import com.example.journey.dto.FrameSnapshot;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 最新帧快照的发布槽
 * <p>
 * 工作线程写入后唤醒所有等待者；任意数量的读取方加同一把锁取出快照，
 * 没有新快照时在条件变量上有限等待。写入方从不等待读取方。
 */
@Component
public class FrameSnapshotPublisher {

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition frameReady = lock.newCondition();

    private FrameSnapshot latest;

    public void publish(FrameSnapshot snapshot) {
        lock.lock();
        try {
            latest = snapshot;
            frameReady.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Optional<FrameSnapshot> latest() {
        lock.lock();
        try {
            return Optional.ofNullable(latest);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 等待一个不同于 {@code previous} 的快照，最多等待 {@code timeout}
     *
     * @param previous 读取方上次拿到的快照，可为null
     * @return 新快照；超时仍没有新快照时为空
     */
    public Optional<FrameSnapshot> awaitChange(FrameSnapshot previous, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (latest == null || latest == previous) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = frameReady.awaitNanos(remaining);
            }
            return Optional.of(latest);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 新一轮运行开始前清空
     */
    public void reset() {
        lock.lock();
        try {
            latest = null;
        } finally {
            lock.unlock();
        }
    }
}
