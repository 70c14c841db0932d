package com.aiinpocket.whalecopy.service.backtest;

import com.aiinpocket.whalecopy.model.dto.PricePoint;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

/**
 * 依時間排序的價格序列查價器。
 * 建構後不可變，可以在多個同時進行的回測之間共用。
 */
public final class PriceResolver {

    private static final PriceResolver EMPTY = new PriceResolver(Map.of());

    private final Map<String, Series> seriesByAsset;

    private PriceResolver(Map<String, Series> seriesByAsset) {
        this.seriesByAsset = seriesByAsset;
    }

    public static PriceResolver empty() {
        return EMPTY;
    }

    /**
     * 由各資產的價格點建立查價器。
     * 價格點會依時間穩定排序，null 或非正數的價格會被略過。
     */
    public static PriceResolver of(Map<String, List<PricePoint>> pointsByAsset) {
        Map<String, Series> map = new HashMap<>();
        pointsByAsset.forEach((asset, points) -> {
            if (asset == null || points == null) return;
            List<PricePoint> valid = new ArrayList<>();
            for (PricePoint p : points) {
                if (p != null && p.timestamp() != null && p.price() != null && p.price().signum() > 0) {
                    valid.add(p);
                }
            }
            if (valid.isEmpty()) return;
            valid.sort(Comparator.comparing(PricePoint::timestamp));
            map.put(asset.toUpperCase(), new Series(valid));
        });
        return new PriceResolver(Map.copyOf(map));
    }

    /**
     * 取得 {@code ts} 當下或之前最近的價格。
     * 沒有該資產的序列，或序列中沒有早於等於 {@code ts} 的點時回傳 {@code fallback}。
     */
    public BigDecimal priceAt(String asset, Instant ts, BigDecimal fallback) {
        if (asset == null) return fallback;
        Series series = seriesByAsset.get(asset.toUpperCase());
        if (series == null) return fallback;
        BigDecimal price = series.latestAtOrBefore(ts);
        return price != null ? price : fallback;
    }

    public boolean hasSeries(String asset) {
        return asset != null && seriesByAsset.containsKey(asset.toUpperCase());
    }

    public Set<String> assets() {
        return seriesByAsset.keySet();
    }

    /** 各資產已排序的價格點，依資產名稱排序 */
    public Map<String, List<PricePoint>> pointsByAsset() {
        Map<String, List<PricePoint>> points = new TreeMap<>();
        for (String asset : assets()) {
            points.put(asset, seriesByAsset.get(asset).points);
        }
        return Collections.unmodifiableMap(points);
    }

    private static final class Series {
        private final List<PricePoint> points;
        private final long[] times;
        private final BigDecimal[] prices;

        Series(List<PricePoint> sorted) {
            points = List.copyOf(sorted);
            times = new long[sorted.size()];
            prices = new BigDecimal[sorted.size()];
            for (int i = 0; i < sorted.size(); i++) {
                times[i] = sorted.get(i).timestamp().toEpochMilli();
                prices[i] = sorted.get(i).price();
            }
        }

        BigDecimal latestAtOrBefore(Instant ts) {
            long target = ts.toEpochMilli();
            int lo = 0;
            int hi = times.length - 1;
            int found = -1;
            // 找最後一個 time <= target
            while (lo <= hi) {
                int mid = (lo + hi) >>> 1;
                if (times[mid] <= target) {
                    found = mid;
                    lo = mid + 1;
                } else {
                    hi = mid - 1;
                }
            }
            return found >= 0 ? prices[found] : null;
        }
    }
}
