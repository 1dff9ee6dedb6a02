package com.nofx.execution.service.lighter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.model.MarginMode;
import com.nofx.execution.model.OrderIntent;
import com.nofx.execution.model.OrderType;
import com.nofx.execution.model.TimeInForce;
import com.nofx.execution.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignerSidecarSubmitterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockWebServer;
    private SignerSidecarSubmitter submitter;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        LighterProperties properties = new LighterProperties();
        properties.setAccountIndex(42L);
        properties.setApiKeyIndex(3);
        properties.getSigner().setBaseUrl(mockWebServer.url("/").toString());

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(500);
        factory.setReadTimeout(500);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        LighterHttpClient httpClient = new LighterHttpClient(
                new RestTemplate(factory),
                CircuitBreaker.ofDefaults("signer"),
                RateLimiter.ofDefaults("signer"),
                new MetricsService(meterRegistry),
                meterRegistry
        );
        submitter = new SignerSidecarSubmitter(httpClient, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void createOrderPostsEncodedIntent() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"hash\":\"0xabc\"}"));

        String hash = submitter.createOrder(OrderIntent.builder()
                .symbol("ETHUSDT")
                .marketIndex(0)
                .clientOrderIndex(1709294400000L)
                .rawQuantity(5000L)
                .limitPrice(303000L)
                .ask(false)
                .reduceOnly(false)
                .orderType(OrderType.LIMIT)
                .timeInForce(TimeInForce.IMMEDIATE_OR_CANCEL)
                .build());

        assertThat(hash).isEqualTo("0xabc");
        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/tx/create-order");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("accountIndex").asLong()).isEqualTo(42L);
        assertThat(body.path("apiKeyIndex").asInt()).isEqualTo(3);
        assertThat(body.path("chainId").asInt()).isEqualTo(2);
        assertThat(body.path("clientOrderIndex").asLong()).isEqualTo(1709294400000L);
        assertThat(body.path("baseAmount").asLong()).isEqualTo(5000L);
        assertThat(body.path("price").asLong()).isEqualTo(303000L);
        assertThat(body.path("isAsk").asInt()).isZero();
        assertThat(body.path("reduceOnly").asInt()).isZero();
        assertThat(body.path("type").asText()).isEqualTo("LIMIT");
        assertThat(body.path("timeInForce").asText()).isEqualTo("IMMEDIATE_OR_CANCEL");
        assertThat(body.get("triggerPrice").isNull()).isTrue();
        assertThat(body.get("orderExpiry").isNull()).isTrue();
    }

    @Test
    void protectiveOrderCarriesTriggerAndExpiry() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"tx_hash\":\"0xdef\"}"));

        String hash = submitter.createOrder(OrderIntent.builder()
                .symbol("ETHUSDT")
                .marketIndex(0)
                .clientOrderIndex(1L)
                .rawQuantity(10000L)
                .limitPrice(280000L)
                .triggerPrice(280000L)
                .expiry(1711886400000L)
                .ask(true)
                .reduceOnly(true)
                .orderType(OrderType.STOP_LOSS)
                .timeInForce(TimeInForce.IMMEDIATE_OR_CANCEL)
                .build());

        assertThat(hash).isEqualTo("0xdef");
        JsonNode body = objectMapper.readTree(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
        assertThat(body.path("isAsk").asInt()).isEqualTo(1);
        assertThat(body.path("reduceOnly").asInt()).isEqualTo(1);
        assertThat(body.path("triggerPrice").asLong()).isEqualTo(280000L);
        assertThat(body.path("orderExpiry").asLong()).isEqualTo(1711886400000L);
        assertThat(body.path("type").asText()).isEqualTo("STOP_LOSS");
    }

    @Test
    void updateLeverageSendsMarginFractionAndMode() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"hash\":\"0x1\"}"));

        submitter.updateLeverage(1, 1000, MarginMode.ISOLATED);

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/tx/update-leverage");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("marketIndex").asInt()).isEqualTo(1);
        assertThat(body.path("initialMarginFraction").asInt()).isEqualTo(1000);
        assertThat(body.path("marginMode").asInt()).isEqualTo(1);
    }

    @Test
    void cancelAllSendsSymbolAndTime() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"hash\":\"0x2\"}"));

        submitter.cancelAllOrders("BTCUSDT", 1709294400000L);

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/tx/cancel-all-orders");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("symbol").asText()).isEqualTo("BTCUSDT");
        assertThat(body.path("time").asLong()).isEqualTo(1709294400000L);
        assertThat(body.path("timeInForce").asText()).isEqualTo("IMMEDIATE_CANCEL_ALL");
    }

    @Test
    void signerErrorIsRejection() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"error\":\"invalid nonce\"}"));

        assertThatThrownBy(() -> submitter.cancelAllOrders("BTCUSDT", 1L))
                .isInstanceOfSatisfying(LighterApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(400);
                    assertThat(e.getMessage()).contains("invalid nonce");
                });
    }

    @Test
    void droppedConnectionHasNoStatus() {
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        assertThatThrownBy(() -> submitter.updateLeverage(0, 500, MarginMode.CROSS))
                .isInstanceOfSatisfying(LighterApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(-1));
    }
}
