package com.nofx.execution.service.lighter;

import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.exception.LighterCircuitOpenException;
import com.nofx.execution.exception.LighterRateLimitException;
import com.nofx.execution.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Single entry point for HTTP calls to the exchange API and the signer sidecar.
 * Calls are rate limited and circuit broken but never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LighterHttpClient {

    private final RestTemplate lighterRestTemplate;
    private final CircuitBreaker lighterCircuitBreaker;
    private final RateLimiter lighterRateLimiter;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;

    public String get(String url) {
        return execute(url, HttpMethod.GET, null);
    }

    public String post(String url, String body) {
        return execute(url, HttpMethod.POST, body);
    }

    private String execute(String url, HttpMethod method, String body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(url, method, body);
        try {
            Supplier<String> decorated = CircuitBreaker.decorateSupplier(lighterCircuitBreaker, supplier);
            decorated = RateLimiter.decorateSupplier(lighterRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            recordFailure(method, url, null, "CIRCUIT_OPEN", e);
            throw new LighterCircuitOpenException("Lighter circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            recordFailure(method, url, 429, "RATE_LIMIT", e);
            throw new LighterRateLimitException("Lighter client rate limit exceeded", e);
        } catch (LighterApiException e) {
            recordFailure(method, url, e.getStatusCode() > 0 ? e.getStatusCode() : null, "HTTP_ERROR", e);
            throw e;
        } finally {
            sample.stop(Timer.builder("lighter_http_latency")
                    .tag("method", method.name())
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url, HttpMethod method, String body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (method == HttpMethod.POST) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
            HttpEntity<String> entity = new HttpEntity<>(body, headers);
            ResponseEntity<String> response = lighterRestTemplate.exchange(url, method, entity, String.class);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            throw new LighterApiException("Lighter API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Lighter network error for {}: {}", url, e.getMessage());
            throw new LighterApiException("Lighter network error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new LighterApiException("Lighter request failed: " + e.getMessage(), e);
        }
    }

    private void recordFailure(HttpMethod method, String url, Integer status, String reason, Exception e) {
        metricsService.incrementExchangeFailures();
        log.warn("Lighter request failed method={} url={} status={} reason={} message={}",
                method, url, status, reason, e.getMessage());
    }
}
