package com.nofx.execution.service.lighter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nofx.execution.config.LighterProperties;
import com.nofx.execution.exception.LighterApiException;
import com.nofx.execution.model.MarketInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.nofx.execution.util.DecimalUtils.bd;

@Slf4j
@Service
@RequiredArgsConstructor
public class LighterRestDataClient implements LighterDataClient {

    private static final int CODE_OK = 200;

    private final LighterHttpClient lighterHttpClient;
    private final LighterProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public List<MarketInfo> listMarkets() {
        JsonNode root = fetch(baseUrl() + "/api/v1/orderBooks");
        requireOk(root);
        JsonNode books = root.path("order_books");
        List<MarketInfo> markets = new ArrayList<>();
        if (!books.isArray()) {
            return markets;
        }
        for (JsonNode book : books) {
            String symbol = book.path("symbol").asText(null);
            if (symbol == null || symbol.isBlank()) {
                log.debug("Skipping order book without symbol: {}", book);
                continue;
            }
            try {
                markets.add(new MarketInfo(
                        symbol,
                        book.path("market_id").asInt(),
                        book.path("supported_size_decimals").asInt(),
                        book.path("supported_price_decimals").asInt()
                ));
            } catch (IllegalArgumentException e) {
                throw new LighterApiException("Invalid market metadata for " + symbol + ": " + e.getMessage(), e);
            }
        }
        return markets;
    }

    @Override
    public Optional<LighterAccount> getAccount(long accountIndex) {
        JsonNode root = fetch(baseUrl() + "/api/v1/account?by=index&value=" + accountIndex);
        requireOk(root);
        JsonNode accounts = root.path("accounts");
        if (!accounts.isArray() || accounts.isEmpty()) {
            return Optional.empty();
        }
        JsonNode account = accounts.get(0);
        try {
            List<LighterAccountPosition> positions = new ArrayList<>();
            for (JsonNode pos : account.path("positions")) {
                positions.add(parsePosition(pos));
            }
            return Optional.of(new LighterAccount(
                    account.path("index").asLong(accountIndex),
                    bd(text(account, "available_balance")),
                    bd(text(account, "collateral")),
                    positions
            ));
        } catch (NumberFormatException e) {
            throw new LighterApiException("Malformed number in account " + accountIndex + ": " + e.getMessage(), e);
        }
    }

    @Override
    public OrderBookDetail getOrderBookDetail(int marketIndex) {
        JsonNode root = fetch(baseUrl() + "/api/v1/orderBookDetails?market_id=" + marketIndex);
        return new OrderBookDetail(
                positiveOrNull(text(root, "mark_price")),
                topOfBook(root.path("asks")),
                topOfBook(root.path("bids"))
        );
    }

    private LighterAccountPosition parsePosition(JsonNode pos) {
        String markPrice = text(pos, "mark_price");
        return new LighterAccountPosition(
                pos.path("market_id").asInt(),
                pos.path("symbol").asText(""),
                bd(text(pos, "initial_margin_fraction")),
                pos.path("sign").asInt(1),
                bd(text(pos, "position")),
                bd(text(pos, "avg_entry_price")),
                bd(text(pos, "position_value")),
                markPrice == null ? null : bd(markPrice),
                bd(text(pos, "unrealized_pnl")),
                bd(text(pos, "realized_pnl")),
                bd(text(pos, "liquidation_price")),
                pos.path("margin_mode").asInt(),
                bd(text(pos, "allocated_margin"))
        );
    }

    private BigDecimal topOfBook(JsonNode levels) {
        if (!levels.isArray() || levels.isEmpty()) {
            return null;
        }
        return positiveOrNull(text(levels.get(0), "price"));
    }

    private BigDecimal positiveOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            BigDecimal parsed = new BigDecimal(value.trim());
            return parsed.signum() > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparsable price '{}'", value);
            return null;
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private void requireOk(JsonNode root) {
        int code = root.path("code").asInt(CODE_OK);
        if (code != CODE_OK) {
            throw new LighterApiException("Lighter API returned code " + code + ": " + root.path("message").asText(""));
        }
    }

    private JsonNode fetch(String url) {
        String body = lighterHttpClient.get(url);
        if (body == null || body.isBlank()) {
            throw new LighterApiException("Empty response from " + url);
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new LighterApiException("Unparsable response from " + url, e);
        }
    }

    private String baseUrl() {
        String endpoint = properties.getEndpoint();
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
