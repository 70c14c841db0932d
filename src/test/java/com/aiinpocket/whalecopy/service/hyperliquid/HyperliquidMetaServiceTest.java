package com.aiinpocket.whalecopy.service.hyperliquid;

import com.aiinpocket.whalecopy.config.CopyTradingProperties;
import com.aiinpocket.whalecopy.config.CopyTradingProperties.CopierParams;
import com.aiinpocket.whalecopy.config.HyperliquidApiProperties;
import com.aiinpocket.whalecopy.model.dto.AssetSizing;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HyperliquidMetaServiceTest {

    private static final String BASE = "https://hl.test";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HyperliquidInfoClient infoClient = mock(HyperliquidInfoClient.class);
    private final HyperliquidMetaService service = new HyperliquidMetaService(infoClient);

    @Test
    void resolvesIndexAndPrecision() {
        when(infoClient.fetchMeta()).thenReturn(objectMapper.readTree("""
                {"universe":[{"name":"BTC","szDecimals":5},{"name":"ETH","szDecimals":4},
                             {"name":"DOGE","szDecimals":0}]}
                """));

        AssetSizing eth = service.resolve("eth").orElseThrow();
        AssetSizing doge = service.resolve("DOGE").orElseThrow();

        assertThat(eth.assetIndex()).isEqualTo(1);
        assertThat(eth.sizeDecimals()).isEqualTo(4);
        assertThat(eth.priceDecimals()).isEqualTo(2);
        assertThat(doge.assetIndex()).isEqualTo(2);
        assertThat(doge.priceDecimals()).isEqualTo(6);
        assertThat(service.resolve("PEPE")).isEqualTo(Optional.empty());
    }

    @Test
    void malformedMetaFails() {
        when(infoClient.fetchMeta()).thenReturn(objectMapper.readTree("{}"));

        assertThatThrownBy(() -> service.resolve("BTC")).isInstanceOf(ExchangeApiException.class);
    }

    @Test
    void spotAssetsUseOffsetIndexAndEightDecimalPrices() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        CopyTradingProperties tradingProps = new CopyTradingProperties(null,
                new CopierParams(1000, 2000, 0, 5000, 1.0, 2000, 300_000, 200, true), null, null);
        HyperliquidInfoClient client = new HyperliquidInfoClient(builder.build(),
                new HyperliquidApiProperties(BASE, "/info", 2000, 10),
                tradingProps,
                objectMapper,
                new HyperliquidFillMapper(),
                Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));

        server.expect(requestTo(BASE + "/info"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.type").value("meta"))
                .andRespond(withSuccess("""
                        {"universe":[{"name":"BTC","szDecimals":5}]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/info"))
                .andExpect(jsonPath("$.type").value("spotMeta"))
                .andRespond(withSuccess("""
                        {"universe":[{"name":"PURR/USDC","tokens":[1,0],"index":0},
                                     {"name":"@107","tokens":[150,0],"index":107}],
                         "tokens":[{"name":"USDC","szDecimals":8},{"name":"PURR","szDecimals":0}]}
                        """, MediaType.APPLICATION_JSON));

        AssetSizing purr = new HyperliquidMetaService(client).resolve("purr/usdc").orElseThrow();

        assertThat(purr.asset()).isEqualTo("PURR/USDC");
        assertThat(purr.assetIndex()).isEqualTo(10000);
        assertThat(purr.sizeDecimals()).isZero();
        assertThat(purr.priceDecimals()).isEqualTo(8);
        server.verify();
    }

    @Test
    void spotPairWithUnknownTokenIsSkipped() {
        when(infoClient.fetchMeta()).thenReturn(objectMapper.readTree("{\"universe\":[]}"));
        when(infoClient.fetchSpotMeta()).thenReturn(objectMapper.readTree("""
                {"universe":[{"name":"@107","tokens":[150,0],"index":107}],
                 "tokens":[{"name":"USDC","szDecimals":8}]}
                """));

        assertThat(service.resolve("@107")).isEmpty();
    }
}
