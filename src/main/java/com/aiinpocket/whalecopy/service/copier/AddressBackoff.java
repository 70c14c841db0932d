package com.aiinpocket.whalecopy.service.copier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 來源地址的指數退避。
 * 每次失敗延遲加倍（base × 2^(n-1)，上限 max），退避期間跳過該地址的所有外部呼叫；
 * 任一次成功立即清除狀態。
 */
public class AddressBackoff {

    private final Duration base;
    private final Duration max;
    private final Clock clock;
    private final Map<String, State> states = new ConcurrentHashMap<>();

    public AddressBackoff(Duration base, Duration max, Clock clock) {
        this.base = base;
        this.max = max;
        this.clock = clock;
    }

    public boolean isBackingOff(String address) {
        State state = states.get(key(address));
        return state != null && clock.instant().isBefore(state.until());
    }

    /**
     * 記錄一次失敗並開啟退避窗。
     *
     * @return 本次退避時長
     */
    public Duration recordFailure(String address) {
        State updated = states.compute(key(address), (k, prev) -> {
            int failures = prev == null ? 1 : prev.failures() + 1;
            Duration delay = delayFor(failures);
            return new State(failures, clock.instant().plus(delay));
        });
        return delayFor(updated.failures());
    }

    public void recordSuccess(String address) {
        states.remove(key(address));
    }

    public int failures(String address) {
        State state = states.get(key(address));
        return state == null ? 0 : state.failures();
    }

    Duration delayFor(int failures) {
        // 超過 30 次後倍數已遠大於上限，避免位移溢位
        int exponent = Math.min(failures - 1, 30);
        long millis = base.toMillis() * (1L << exponent);
        return millis >= max.toMillis() ? max : Duration.ofMillis(millis);
    }

    private static String key(String address) {
        return address.toLowerCase();
    }

    private record State(int failures, Instant until) {}
}
