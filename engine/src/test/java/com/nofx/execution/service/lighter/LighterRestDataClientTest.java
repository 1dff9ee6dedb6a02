package com.nofx.execution.service.lighter;

import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.model.MarketInfo;
import com.nofx.execution.service.MetricsService;
import com.nofx.execution.service.lighter.LighterDataClient.LighterAccount;
import com.nofx.execution.service.lighter.LighterDataClient.LighterAccountPosition;
import com.nofx.execution.service.lighter.LighterDataClient.OrderBookDetail;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LighterRestDataClientTest {

    private MockWebServer mockWebServer;
    private LighterRestDataClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        LighterProperties properties = new LighterProperties();
        properties.setEndpoint(mockWebServer.url("/").toString());

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        LighterHttpClient httpClient = new LighterHttpClient(
                new RestTemplate(),
                CircuitBreaker.ofDefaults("test"),
                RateLimiter.ofDefaults("test"),
                new MetricsService(meterRegistry),
                meterRegistry
        );
        client = new LighterRestDataClient(httpClient, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void listMarketsParsesPrecisionAndSkipsUnnamedBooks() throws Exception {
        mockWebServer.enqueue(json("""
                {"code":200,"order_books":[
                  {"symbol":"ETH","market_id":0,"supported_size_decimals":4,"supported_price_decimals":2},
                  {"symbol":"","market_id":9,"supported_size_decimals":1,"supported_price_decimals":1},
                  {"symbol":"BTC","market_id":1,"supported_size_decimals":5,"supported_price_decimals":1}
                ]}
                """));

        List<MarketInfo> markets = client.listMarkets();

        assertThat(markets).containsExactly(new MarketInfo("ETH", 0, 4, 2), new MarketInfo("BTC", 1, 5, 1));
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/v1/orderBooks");
    }

    @Test
    void nonOkCodeIsAnError() {
        mockWebServer.enqueue(json("{\"code\":500,\"message\":\"internal\"}"));

        assertThatThrownBy(() -> client.listMarkets())
                .isInstanceOf(LighterApiException.class)
                .hasMessageContaining("internal");
    }

    @Test
    void negativeDecimalsAreRejected() {
        mockWebServer.enqueue(json("""
                {"code":200,"order_books":[{"symbol":"ETH","market_id":0,"supported_size_decimals":-1,"supported_price_decimals":2}]}
                """));

        assertThatThrownBy(() -> client.listMarkets()).isInstanceOf(LighterApiException.class);
    }

    @Test
    void accountParsesBalancesAndPositions() throws Exception {
        mockWebServer.enqueue(json("""
                {"code":200,"total":1,"accounts":[{
                  "index":42,"available_balance":"812.50","collateral":"1000.25",
                  "positions":[{
                    "market_id":0,"symbol":"ETH","initial_margin_fraction":"10.00","sign":-1,
                    "position":"2.5000","avg_entry_price":"3100.00","position_value":"7500.00",
                    "unrealized_pnl":"250.00","realized_pnl":"0.00","liquidation_price":"3900.0",
                    "margin_mode":0,"allocated_margin":"0"
                  }]
                }]}
                """));

        Optional<LighterAccount> account = client.getAccount(42L);

        assertThat(account).isPresent();
        assertThat(account.get().collateral()).isEqualByComparingTo("1000.25");
        assertThat(account.get().availableBalance()).isEqualByComparingTo("812.50");
        LighterAccountPosition position = account.get().positions().get(0);
        assertThat(position.symbol()).isEqualTo("ETH");
        assertThat(position.signedQuantity()).isEqualByComparingTo("-2.5");
        assertThat(position.markPrice()).isNull();
        assertThat(position.initialMarginFraction()).isEqualByComparingTo("10");

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/api/v1/account?by=index&value=42");
    }

    @Test
    void emptyAccountListIsAbsent() {
        mockWebServer.enqueue(json("{\"code\":200,\"total\":0,\"accounts\":[]}"));

        assertThat(client.getAccount(42L)).isEmpty();
    }

    @Test
    void orderBookDetailKeepsOnlyPositivePrices() throws Exception {
        mockWebServer.enqueue(json("""
                {"code":200,"mark_price":"0","asks":[{"price":"3001.5","size":"1"}],"bids":[{"price":"2999.5","size":"2"}]}
                """));

        OrderBookDetail detail = client.getOrderBookDetail(0);

        assertThat(detail.markPrice()).isNull();
        assertThat(detail.bestAsk()).isEqualByComparingTo("3001.5");
        assertThat(detail.bestBid()).isEqualByComparingTo("2999.5");
        assertThat(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getPath())
                .isEqualTo("/api/v1/orderBookDetails?market_id=0");
    }

    @Test
    void httpErrorCarriesStatus() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

        assertThatThrownBy(() -> client.getOrderBookDetail(1))
                .isInstanceOfSatisfying(LighterApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(503));
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
