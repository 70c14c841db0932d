package com.aiinpocket.whalecopy.model.enums;

import java.time.Duration;
import java.time.Instant;

/**
 * 回測時鐘的步長。
 * 區間越長步長越粗，用來限制長期回測的迴圈次數。
 */
public enum SimulationStep {

    ONE_MINUTE(Duration.ofMinutes(1)),
    FIVE_MINUTES(Duration.ofMinutes(5)),
    FIFTEEN_MINUTES(Duration.ofMinutes(15));

    private static final Duration ONE_MINUTE_LIMIT = Duration.ofDays(30);
    private static final Duration FIVE_MINUTES_LIMIT = Duration.ofDays(365);

    private final Duration duration;

    SimulationStep(Duration duration) {
        this.duration = duration;
    }

    public Duration getDuration() {
        return duration;
    }

    /** 30 天內用 1 分鐘、一年內用 5 分鐘，更長用 15 分鐘 */
    public static SimulationStep forSpan(Instant start, Instant end) {
        Duration span = Duration.between(start, end);
        if (span.compareTo(ONE_MINUTE_LIMIT) <= 0) return ONE_MINUTE;
        if (span.compareTo(FIVE_MINUTES_LIMIT) <= 0) return FIVE_MINUTES;
        return FIFTEEN_MINUTES;
    }

    /** 將時間向下對齊到步長邊界（以 epoch 為基準） */
    public Instant truncate(Instant ts) {
        long stepMillis = duration.toMillis();
        long millis = ts.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, stepMillis) * stepMillis);
    }
}
