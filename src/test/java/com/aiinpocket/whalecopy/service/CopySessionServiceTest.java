package com.aiinpocket.whalecopy.service;

import com.aiinpocket.whalecopy.model.dto.AdaptiveSetting;
import com.aiinpocket.whalecopy.model.dto.CopySessionOptions;
import com.aiinpocket.whalecopy.model.entity.BacktestRun;
import com.aiinpocket.whalecopy.model.entity.TrackedWhale;
import com.aiinpocket.whalecopy.repository.BacktestRunRepository;
import com.aiinpocket.whalecopy.repository.TrackedWhaleRepository;
import com.aiinpocket.whalecopy.service.copier.CopySessionManager;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class CopySessionServiceTest {

    private final BacktestRunRepository runRepository = mock(BacktestRunRepository.class);
    private final TrackedWhaleRepository whaleRepository = mock(TrackedWhaleRepository.class);
    private final CopySessionManager manager = mock(CopySessionManager.class);
    private final CopySessionService service = new CopySessionService(runRepository, whaleRepository, manager);

    @Test
    void startFromRunUsesRunParameters() {
        BacktestRun run = BacktestRun.builder().id(3L).name("eth-swing").whaleId(9L)
                .leverage(new BigDecimal("3")).positionSizePct(new BigDecimal("12.5"))
                .assetSymbols("eth, btc").initialDepositUsd(new BigDecimal("5000")).build();
        when(runRepository.findById(3L)).thenReturn(Optional.of(run));
        when(whaleRepository.findById(9L))
                .thenReturn(Optional.of(TrackedWhale.builder().id(9L).address("0xabc").build()));

        service.startFromRun(3L, null, true, null);

        ArgumentCaptor<CopySessionOptions> captor = ArgumentCaptor.forClass(CopySessionOptions.class);
        verify(manager).createSession(captor.capture());
        CopySessionOptions options = captor.getValue();
        assertThat(options.address()).isEqualTo("0xabc");
        assertThat(options.leverage().value()).isEqualByComparingTo("3");
        assertThat(options.positionSizePct().value()).isEqualByComparingTo("12.5");
        assertThat(options.assetSymbols()).containsExactlyInAnyOrder("ETH", "BTC");
        assertThat(options.depositUsd()).isEqualByComparingTo("5000");
        assertThat(options.execute()).isTrue();
    }

    @Test
    void positionSizeOverride() {
        BacktestRun run = BacktestRun.builder().id(3L).whaleId(9L).positionSizePct(BigDecimal.TEN).build();
        when(runRepository.findById(3L)).thenReturn(Optional.of(run));
        when(whaleRepository.findById(9L))
                .thenReturn(Optional.of(TrackedWhale.builder().id(9L).address("0xabc").build()));

        service.startFromRun(3L, new BigDecimal("250"), false, AdaptiveSetting.auto());

        ArgumentCaptor<CopySessionOptions> captor = ArgumentCaptor.forClass(CopySessionOptions.class);
        verify(manager).createSession(captor.capture());
        assertThat(captor.getValue().positionSizePct().isAuto()).isTrue();
        assertThat(captor.getValue().leverage().value()).isEqualByComparingTo("1");
    }

    @Test
    void unknownRun() {
        when(runRepository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.startFromRun(1L, null, false, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(manager);
    }

    @Test
    void parseAssets() {
        assertThat(CopySessionService.parseAssets(null)).isEmpty();
        assertThat(CopySessionService.parseAssets(" sol,,Doge ")).containsExactlyInAnyOrder("SOL", "DOGE");
    }
}
