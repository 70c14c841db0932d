package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.config.CopyTradingProperties.BacktestParams;
import com.aiinpocket.whalecopy.config.CopyTradingProperties.CopierParams;
import com.aiinpocket.whalecopy.config.CopyTradingProperties.IngestParams;
import com.aiinpocket.whalecopy.config.CopyTradingProperties.SignalParams;
import com.aiinpocket.whalecopy.model.dto.*;
import com.aiinpocket.whalecopy.model.enums.CopySessionState;
import com.aiinpocket.whalecopy.model.enums.TradeDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CopySessionManagerTest {

    private static final String ADDR = "0xwhale";
    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    private MutableClock clock;
    private CopySourceGateway source;
    private TradingGateway trading;
    private AssetSizingProvider sizing;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        source = mock(CopySourceGateway.class);
        trading = mock(TradingGateway.class);
        sizing = mock(AssetSizingProvider.class);
        when(sizing.resolve("BTC")).thenReturn(Optional.of(AssetSizing.perp("BTC", 0, 5)));
        when(sizing.resolve("ETH")).thenReturn(Optional.of(AssetSizing.perp("ETH", 1, 4)));
        when(source.fetchAccountState(ADDR)).thenReturn(account("10000"));
    }

    private CopySessionManager manager(long accountTtlMs) {
        CopyTradingProperties props = new CopyTradingProperties(
                new BacktestParams(5, 5, 1, 5, 5),
                new CopierParams(1000, 2000, 334, accountTtlMs, 1.0, 2000, 300_000, 200, true),
                new SignalParams(15, 2),
                new IngestParams("0 */5 * * * ?", 10));
        return new CopySessionManager(source, trading, sizing, props, clock);
    }

    private static AccountState account(String value, AccountState.OpenPosition... positions) {
        return new AccountState(new BigDecimal(value), List.of(positions));
    }

    private static AccountState.OpenPosition position(String asset, String signedSize, String price) {
        return new AccountState.OpenPosition(asset, new BigDecimal(signedSize),
                new BigDecimal(price), new BigDecimal(price), BigDecimal.ZERO);
    }

    private static Fill fill(String id, Instant time, String asset, TradeDirection dir, boolean buy,
                             String size, String price) {
        return new Fill(id, time, asset, dir, buy, new BigDecimal(size), new BigDecimal(price), null);
    }

    private static CopySessionOptions fixedOptions(boolean execute, String... assets) {
        return new CopySessionOptions(7L, ADDR,
                AdaptiveSetting.fixed(BigDecimal.ONE), AdaptiveSetting.fixed(BigDecimal.valueOf(100)),
                Set.of(assets), null, execute);
    }

    @Nested
    @DisplayName("建立 session")
    class Create {

        @Test
        @DisplayName("游標設在最新歷史成交，歷史成交不會被重播")
        void seedsCursorFromHistory() {
            Fill old = fill("h:1", T0.minusSeconds(60), "BTC", TradeDirection.LONG, true, "1", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(old), List.of(old));
            CopySessionManager m = manager(5000);

            CopySessionStatus created = m.createSession(fixedOptions(false));
            m.tick();

            CopySessionStatus status = m.getStatus(created.sessionId()).orElseThrow();
            assertThat(status.cursor()).isEqualTo(old.time());
            assertThat(status.processed()).isZero();
            assertThat(status.state()).isEqualTo(CopySessionState.ACTIVE);
            assertThat(status.notifications()).anyMatch(n -> n.startsWith("略過"));
        }

        @Test
        @DisplayName("讀取失敗不阻擋建立，只記錄錯誤")
        void toleratesSourceFailures() {
            when(source.fetchFills(eq(ADDR), any())).thenThrow(new IllegalStateException("timeout"));
            when(source.fetchAccountState(ADDR)).thenThrow(new IllegalStateException("timeout"));

            CopySessionStatus created = manager(5000).createSession(fixedOptions(false));

            assertThat(created.active()).isTrue();
            assertThat(created.cursor()).isEqualTo(T0);
            assertThat(created.errors()).hasSize(2);
        }

        @Test
        @DisplayName("歷史成交讀取失敗時，建立之前的成交仍不會被跟單")
        void seedFailureDoesNotReplayHistory() {
            Fill dayOld = fill("h:1", T0.minus(Duration.ofHours(24)), "BTC", TradeDirection.LONG, true, "1", "60000");
            Fill hourOld = fill("h:2", T0.minus(Duration.ofHours(1)), "ETH", TradeDirection.SHORT, false, "2", "3000");
            Fill fresh = fill("h:3", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "0.5", "60000");
            when(source.fetchFills(eq(ADDR), any()))
                    .thenThrow(new IllegalStateException("timeout"))
                    .thenReturn(List.of(dayOld, hourOld, fresh));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            ArgumentCaptor<CopyOrder> captor = ArgumentCaptor.forClass(CopyOrder.class);
            verify(trading, times(1)).submitOrder(captor.capture());
            assertThat(captor.getValue().asset()).isEqualTo("BTC");
            assertThat(captor.getValue().size()).isEqualByComparingTo("0.5");
            CopySessionStatus status = m.getStatus(id).orElseThrow();
            assertThat(status.processed()).isEqualTo(1);
            assertThat(status.cursor()).isEqualTo(fresh.time());
        }

        @Test
        @DisplayName("沒有歷史成交時游標從建立時間開始")
        void emptyHistoryStartsAtCreation() {
            Fill before = fill("h:1", T0.minusSeconds(30), "BTC", TradeDirection.LONG, true, "1", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(before));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            verify(trading, never()).submitOrder(any());
            assertThat(m.getStatus(id).orElseThrow().processed()).isZero();
        }
    }

    @Nested
    @DisplayName("處理成交")
    class Processing {

        @Test
        @DisplayName("同一筆成交重複出現只處理一次")
        void idempotentReplay() {
            Fill f1 = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "0.5", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(f1), List.of(f1), List.of(f1));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(false)).sessionId();

            m.tick();
            m.tick();
            m.tick();

            CopySessionStatus status = m.getStatus(id).orElseThrow();
            assertThat(status.processed()).isEqualTo(1);
            assertThat(status.cursor()).isEqualTo(f1.time());
            assertThat(status.shadowPositions()).containsKey("BTC");
            assertThat(status.shadowPositions().get("BTC")).isEqualByComparingTo("0.5");
        }

        @Test
        @DisplayName("dry-run 不送單也不更新槓桿")
        void dryRunDoesNotSubmit() {
            Fill f1 = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "0.5", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(f1));
            CopySessionManager m = manager(5000);
            m.createSession(fixedOptions(false));

            m.tick();

            verify(trading, never()).submitOrder(any());
            verify(trading, never()).updateLeverage(anyString(), any(), anyBoolean());
        }

        @Test
        @DisplayName("實單模式送出滑價調整並依精度取整的 IOC 單")
        void executeSubmitsRoundedOrder() {
            Fill f1 = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "0.123456", "65000.5");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(f1));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            ArgumentCaptor<CopyOrder> captor = ArgumentCaptor.forClass(CopyOrder.class);
            verify(trading).submitOrder(captor.capture());
            CopyOrder order = captor.getValue();
            assertThat(order.sessionId()).isEqualTo(id);
            assertThat(order.buy()).isTrue();
            assertThat(order.size()).isEqualByComparingTo("0.12346");
            // 65000.5 × 1.01 = 65650.505 → 5 位有效數字
            assertThat(order.limitPrice()).isEqualByComparingTo("65651");
            assertThat(order.timeInForce()).isEqualTo(CopyOrder.IOC);
            verify(trading).updateLeverage("BTC", BigDecimal.ONE, true);
        }

        @Test
        @DisplayName("賣單價格往下調整滑價")
        void sellSlippageBelowFill() {
            CopySessionManager m = manager(5000);
            CopyOrder order = m.buildOrder(1, AssetSizing.perp("ETH", 1, 4),
                    false, new BigDecimal("2"), new BigDecimal("100"));

            assertThat(order.limitPrice()).isEqualByComparingTo("99");
            assertThat(order.assetIndex()).isEqualTo(1);
        }

        @Test
        @DisplayName("下單失敗記錄錯誤，不更新影子持倉")
        void submitFailureRecorded() {
            Fill f1 = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "1", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(f1));
            doThrow(new IllegalStateException("rejected")).when(trading).submitOrder(any());
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            CopySessionStatus status = m.getStatus(id).orElseThrow();
            assertThat(status.errors()).anyMatch(e -> e.contains("rejected"));
            assertThat(status.shadowPositions()).isEmpty();
        }

        @Test
        @DisplayName("白名單外與未知資產不跟單")
        void filtersAssets() {
            Fill eth = fill("h:1", T0.plusSeconds(1), "ETH", TradeDirection.LONG, true, "1", "3000");
            Fill doge = fill("h:2", T0.plusSeconds(2), "DOGE", TradeDirection.LONG, true, "1", "0.1");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(eth, doge));
            when(sizing.resolve("DOGE")).thenReturn(Optional.empty());
            CopySessionManager m = manager(5000);
            long onlyBtc = m.createSession(fixedOptions(true, "BTC")).sessionId();

            m.tick();

            assertThat(m.getStatus(onlyBtc).orElseThrow().processed()).isZero();
            verify(trading, never()).submitOrder(any());
        }

        @Test
        @DisplayName("未知資產記錄錯誤")
        void unknownAssetError() {
            Fill doge = fill("h:2", T0.plusSeconds(2), "DOGE", TradeDirection.LONG, true, "1", "0.1");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(doge));
            when(sizing.resolve("DOGE")).thenReturn(Optional.empty());
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            assertThat(m.getStatus(id).orElseThrow().errors()).anyMatch(e -> e.contains("未知資產 DOGE"));
            verify(trading, never()).submitOrder(any());
        }
    }

    @Nested
    @DisplayName("下單精度")
    class Sizing {

        @Test
        @DisplayName("精度讀取失敗只略過該筆成交並進入退避")
        void sizingFailureSkipsOnlyThatFill() {
            when(sizing.resolve("ETH")).thenThrow(new IllegalStateException("meta down"));
            Fill eth = fill("h:1", T0.plusSeconds(1), "ETH", TradeDirection.LONG, true, "1", "3000");
            Fill btc = fill("h:2", T0.plusSeconds(2), "BTC", TradeDirection.LONG, true, "0.5", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(eth, btc));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            ArgumentCaptor<CopyOrder> captor = ArgumentCaptor.forClass(CopyOrder.class);
            verify(trading, times(1)).submitOrder(captor.capture());
            assertThat(captor.getValue().asset()).isEqualTo("BTC");
            CopySessionStatus status = m.getStatus(id).orElseThrow();
            assertThat(status.processed()).isEqualTo(1);
            assertThat(status.errors()).anyMatch(e -> e.contains("meta down"));
            assertThat(status.state()).isEqualTo(CopySessionState.BACKING_OFF);
        }
    }

    @Nested
    @DisplayName("開倉前持倉")
    class PreSession {

        @Test
        @DisplayName("開倉前多單的平倉不跟，只跟反向超出的部分")
        void suppressesCloseOfPreSessionPosition() {
            when(source.fetchAccountState(ADDR)).thenReturn(account("10000", position("BTC", "1", "60000")));
            Fill sell = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.CLOSE_LONG, false, "1.5", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(sell));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            ArgumentCaptor<CopyOrder> captor = ArgumentCaptor.forClass(CopyOrder.class);
            verify(trading).submitOrder(captor.capture());
            assertThat(captor.getValue().buy()).isFalse();
            assertThat(captor.getValue().size()).isEqualByComparingTo("0.5");
            CopySessionStatus status = m.getStatus(id).orElseThrow();
            assertThat(status.notifications()).anyMatch(n -> n.startsWith("偵測到開倉前既有持倉"));
            assertThat(status.notifications()).anyMatch(n -> n.startsWith("忽略開倉前持倉 BTC"));
        }

        @Test
        @DisplayName("完全落在開倉前持倉內的平倉不送單")
        void fullySuppressed() {
            when(source.fetchAccountState(ADDR)).thenReturn(account("10000", position("ETH", "-3", "3000")));
            Fill buy = fill("h:1", T0.plusSeconds(5), "ETH", TradeDirection.CLOSE_SHORT, true, "2", "3000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(buy));
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            verify(trading, never()).submitOrder(any());
            assertThat(m.getStatus(id).orElseThrow().processed()).isZero();
        }
    }

    @Nested
    @DisplayName("自動比例與槓桿")
    class Adaptive {

        @Test
        @DisplayName("自動跟單比例 = 投入資金 / 來源帳戶淨值")
        void autoPositionSize() {
            when(source.fetchAccountState(ADDR)).thenReturn(account("1000"));
            Fill f1 = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "1", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(f1));
            CopySessionManager m = manager(5000);
            m.createSession(new CopySessionOptions(null, ADDR, AdaptiveSetting.fixed(BigDecimal.ONE),
                    AdaptiveSetting.auto(), Set.of(), new BigDecimal("100"), true));

            m.tick();

            ArgumentCaptor<CopyOrder> captor = ArgumentCaptor.forClass(CopyOrder.class);
            verify(trading).submitOrder(captor.capture());
            assertThat(captor.getValue().size()).isEqualByComparingTo("0.1");
        }

        @Test
        @DisplayName("槓桿只在變動時更新，且同資產在節流間隔內只更新一次")
        void leverageThrottled() {
            when(source.fetchAccountState(ADDR)).thenReturn(
                    account("1000", position("ETH", "1", "2000")),
                    account("1000", position("ETH", "1", "2000")),
                    account("1000", position("ETH", "1", "3000")),
                    account("1000", position("ETH", "1", "3000")));
            Fill f1 = fill("h:1", T0.plusSeconds(1), "BTC", TradeDirection.LONG, true, "0.01", "60000");
            Fill f2 = fill("h:2", T0.plusSeconds(2), "BTC", TradeDirection.LONG, true, "0.01", "60000");
            Fill f3 = fill("h:3", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "0.01", "60000");
            when(source.fetchFills(eq(ADDR), any()))
                    .thenReturn(List.of(), List.of(f1), List.of(f2), List.of(f3));
            CopySessionManager m = manager(0);
            m.createSession(new CopySessionOptions(null, ADDR, AdaptiveSetting.auto(),
                    AdaptiveSetting.fixed(BigDecimal.valueOf(100)), Set.of(), null, true));

            m.tick();
            clock.advance(Duration.ofMillis(500));
            m.tick();
            clock.advance(Duration.ofMillis(2000));
            m.tick();

            ArgumentCaptor<BigDecimal> leverages = ArgumentCaptor.forClass(BigDecimal.class);
            verify(trading, times(2)).updateLeverage(eq("BTC"), leverages.capture(), eq(true));
            assertThat(leverages.getAllValues().get(0)).isEqualByComparingTo("2");
            assertThat(leverages.getAllValues().get(1)).isEqualByComparingTo("3");
            verify(trading, times(3)).submitOrder(any());
        }

        @Test
        @DisplayName("槓桿更新失敗時忽略並照常送單")
        void leverageFailureIgnored() {
            Fill f1 = fill("h:1", T0.plusSeconds(5), "BTC", TradeDirection.LONG, true, "1", "60000");
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of(), List.of(f1));
            doThrow(new IllegalStateException("boom")).when(trading).updateLeverage(anyString(), any(), anyBoolean());
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(true)).sessionId();

            m.tick();

            verify(trading).submitOrder(any());
            assertThat(m.getStatus(id).orElseThrow().errors()).anyMatch(e -> e.startsWith("槓桿更新失敗"));
        }
    }

    @Nested
    @DisplayName("退避與停止")
    class Lifecycle {

        @Test
        @DisplayName("讀取成交失敗後退避，期間不再呼叫來源")
        void backsOffAfterFailure() {
            when(source.fetchFills(eq(ADDR), any()))
                    .thenReturn(List.of())
                    .thenThrow(new IllegalStateException("429"))
                    .thenReturn(List.of());
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(false)).sessionId();

            m.tick();
            assertThat(m.getStatus(id).orElseThrow().state()).isEqualTo(CopySessionState.BACKING_OFF);
            m.tick();
            verify(source, times(2)).fetchFills(eq(ADDR), any());

            clock.advance(Duration.ofSeconds(2));
            m.tick();
            verify(source, times(3)).fetchFills(eq(ADDR), any());
            CopySessionStatus status = m.getStatus(id).orElseThrow();
            assertThat(status.state()).isEqualTo(CopySessionState.ACTIVE);
            assertThat(status.errors()).anyMatch(e -> e.contains("429"));
        }

        @Test
        @DisplayName("停止後不再輪詢，移除後查不到")
        void stopAndRemove() {
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of());
            CopySessionManager m = manager(5000);
            long id = m.createSession(fixedOptions(false)).sessionId();

            assertThat(m.stopSession(id)).isTrue();
            m.tick();

            verify(source, times(1)).fetchFills(eq(ADDR), any());
            assertThat(m.getStatus(id).orElseThrow().state()).isEqualTo(CopySessionState.STOPPED);
            assertThat(m.stopSession(999)).isFalse();
            assertThat(m.removeSession(id)).isTrue();
            assertThat(m.getStatus(id)).isEmpty();
            assertThat(m.listStatuses()).isEmpty();
        }

        @Test
        @DisplayName("單一 session 失敗不影響其他 session")
        void sessionsIsolated() {
            when(source.fetchFills(eq(ADDR), any())).thenReturn(List.of());
            when(source.fetchFills(eq("0xother"), any())).thenThrow(new IllegalStateException("down"));
            CopySessionManager m = manager(5000);
            m.createSession(new CopySessionOptions(null, "0xother", null,
                    AdaptiveSetting.fixed(BigDecimal.TEN), Set.of(), null, false));
            m.createSession(fixedOptions(false));

            m.tick();

            verify(source, times(2)).fetchFills(eq(ADDR), any());
            assertThat(m.listStatuses()).hasSize(2);
        }
    }
}
