package com.nofx.execution.service.lighter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.model.MarginMode;
import com.nofx.execution.model.OrderIntent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hands transactions to the signer sidecar, which holds the API private key.
 * The payload carries only encoded integers; the sidecar does no unit conversion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignerSidecarSubmitter implements TransactionSubmitter {

    private final LighterHttpClient lighterHttpClient;
    private final LighterProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String createOrder(OrderIntent intent) {
        ObjectNode payload = basePayload();
        payload.put("marketIndex", intent.getMarketIndex());
        payload.put("clientOrderIndex", intent.getClientOrderIndex());
        payload.put("baseAmount", intent.getRawQuantity());
        payload.put("price", intent.getLimitPrice());
        payload.put("isAsk", intent.isAsk() ? 1 : 0);
        payload.put("type", intent.getOrderType().name());
        payload.put("timeInForce", intent.getTimeInForce().name());
        payload.put("reduceOnly", intent.isReduceOnly() ? 1 : 0);
        if (intent.getTriggerPrice() != null) {
            payload.put("triggerPrice", intent.getTriggerPrice());
        } else {
            payload.putNull("triggerPrice");
        }
        if (intent.getExpiry() != null) {
            payload.put("orderExpiry", intent.getExpiry());
        } else {
            payload.putNull("orderExpiry");
        }
        return send("/tx/create-order", payload);
    }

    @Override
    public String cancelAllOrders(String symbol, long timestampMillis) {
        ObjectNode payload = basePayload();
        payload.put("symbol", symbol);
        payload.put("timeInForce", "IMMEDIATE_CANCEL_ALL");
        payload.put("time", timestampMillis);
        return send("/tx/cancel-all-orders", payload);
    }

    @Override
    public String updateLeverage(int marketIndex, int initialMarginFraction, MarginMode marginMode) {
        ObjectNode payload = basePayload();
        payload.put("marketIndex", marketIndex);
        payload.put("initialMarginFraction", initialMarginFraction);
        payload.put("marginMode", marginMode.wireValue());
        return send("/tx/update-leverage", payload);
    }

    private ObjectNode basePayload() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("accountIndex", properties.getAccountIndex());
        payload.put("apiKeyIndex", properties.getApiKeyIndex());
        payload.put("chainId", properties.getChainId());
        return payload;
    }

    private String send(String path, ObjectNode payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new LighterApiException("Failed to encode signer payload for " + path, e);
        }
        String response = lighterHttpClient.post(signerUrl() + path, body);
        String hash = readHash(response);
        log.debug("Signer accepted {} hash={}", path, hash);
        return hash;
    }

    private String readHash(String response) {
        if (response == null || response.isBlank()) {
            throw new LighterApiException("Signer returned an empty response");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            String error = root.path("error").asText("");
            if (!error.isBlank()) {
                throw new LighterApiException("Signer rejected transaction: " + error, 400, null);
            }
            String hash = root.path("hash").asText(root.path("tx_hash").asText(""));
            if (hash.isBlank()) {
                throw new LighterApiException("Signer response has no transaction hash: " + response, 400, null);
            }
            return hash;
        } catch (JsonProcessingException e) {
            throw new LighterApiException("Unparsable signer response", e);
        }
    }

    private String signerUrl() {
        String base = properties.getSigner().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
