package com.aiinpocket.whalecopy.service.copier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongConsumer;

/**
 * 以 key 區分的最小間隔節流器。
 * {@link #canRun}/{@link #touch} 供「時間未到就跳過」的場景，
 * {@link #acquire} 則在間隔未到時睡到可以執行為止，呼叫不會被丟棄。
 */
public class RateThrottle {

    private final Duration minInterval;
    private final Clock clock;
    private final LongConsumer sleeper;
    private final Map<String, Instant> lastRun = new ConcurrentHashMap<>();
    private final ReentrantLock acquireLock = new ReentrantLock();

    public RateThrottle(Duration minInterval, Clock clock) {
        this(minInterval, clock, RateThrottle::sleepQuietly);
    }

    RateThrottle(Duration minInterval, Clock clock, LongConsumer sleeper) {
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public boolean canRun(String key) {
        Instant last = lastRun.get(key);
        return last == null || Duration.between(last, clock.instant()).compareTo(minInterval) >= 0;
    }

    public void touch(String key) {
        lastRun.put(key, clock.instant());
    }

    /**
     * 阻塞直到距離上次執行已滿最小間隔，然後記錄本次執行。
     * 同一時間只有一個呼叫者在等待，多個呼叫者會依序通過。
     */
    public void acquire(String key) {
        acquireLock.lock();
        try {
            long waitMs = remainingMillis(key);
            if (waitMs > 0) {
                sleeper.accept(waitMs);
            }
            touch(key);
        } finally {
            acquireLock.unlock();
        }
    }

    long remainingMillis(String key) {
        Instant last = lastRun.get(key);
        if (last == null) return 0;
        long elapsed = Duration.between(last, clock.instant()).toMillis();
        return Math.max(0, minInterval.toMillis() - elapsed);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
