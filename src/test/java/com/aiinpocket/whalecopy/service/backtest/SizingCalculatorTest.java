package com.aiinpocket.whalecopy.service.backtest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SizingCalculatorTest {

    private static List<BigDecimal> values(int... vs) {
        return java.util.Arrays.stream(vs).mapToObj(BigDecimal::valueOf).toList();
    }

    @Test
    @DisplayName("第 75 百分位數以線性內插：[10,20,30,40] → 32.5")
    void percentileInterpolates() {
        assertThat(SizingCalculator.percentile(values(40, 10, 30, 20), 75)).isEqualByComparingTo("32.5");
    }

    @Test
    void percentileEdges() {
        assertThat(SizingCalculator.percentile(values(), 75)).isEqualByComparingTo("0");
        assertThat(SizingCalculator.percentile(values(7), 75)).isEqualByComparingTo("7");
        assertThat(SizingCalculator.percentile(values(1, 2, 3), 0)).isEqualByComparingTo("1");
        assertThat(SizingCalculator.percentile(values(1, 2, 3), 100)).isEqualByComparingTo("3");
        assertThat(SizingCalculator.percentile(values(1, 2, 3), 50)).isEqualByComparingTo("2");
    }

    @Test
    @DisplayName("建議比例 = 初始資金 / 第 75 百分位數")
    void recommendedRatio() {
        // p75 of [1000, 2000, 3000, 4000] = 3250
        BigDecimal ratio = SizingCalculator.recommendedRatio(
                BigDecimal.valueOf(1300), values(1000, 2000, 3000, 4000));

        assertThat(ratio).isEqualByComparingTo("0.4");
    }

    @Test
    @DisplayName("建議比例最多 1，沒有歷史進場時為 1")
    void recommendedRatioBounds() {
        assertThat(SizingCalculator.recommendedRatio(BigDecimal.valueOf(1_000_000), values(10, 20)))
                .isEqualByComparingTo("1");
        assertThat(SizingCalculator.recommendedRatio(BigDecimal.valueOf(100), values()))
                .isEqualByComparingTo("1");
        assertThat(SizingCalculator.recommendedRatio(BigDecimal.valueOf(100), values(0, 0)))
                .isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("負值以絕對值計算")
    void negativeNotionalsUseAbsoluteValue() {
        List<BigDecimal> sizes = List.of(new BigDecimal("-400"), new BigDecimal("400"));
        assertThat(SizingCalculator.recommendedRatio(BigDecimal.valueOf(100), sizes))
                .isEqualByComparingTo("0.25");
    }
}
