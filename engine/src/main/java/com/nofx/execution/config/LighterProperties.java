package com.nofx.execution.config;

import com.nofx.execution.model.MarginMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "lighter")
@Data
@Validated
public class LighterProperties {

    @NotBlank
    private String endpoint = "https://mainnet.zklighter.elliot.ai";

    @Min(0)
    private long accountIndex;

    @Min(0)
    private int apiKeyIndex;

    // testnet=1, mainnet=2
    @Positive
    private int chainId = 2;

    @NotBlank
    private String quoteSuffix = "USDT";

    private SignerProperties signer = new SignerProperties();

    private CodecProperties codec = new CodecProperties();

    private ExecutionSettings execution = new ExecutionSettings();

    @Data
    public static class SignerProperties {
        @NotBlank
        private String baseUrl = "http://localhost:8090";
    }

    @Data
    public static class CodecProperties {
        /**
         * Precision used when a symbol has no cached market metadata.
         */
        @Min(0)
        private int fallbackDecimals = 4;

        /**
         * When true, encoding a symbol without market metadata fails instead of
         * using {@link #fallbackDecimals}.
         */
        private boolean failClosedOnUnknownMarket = false;
    }

    @Data
    public static class ExecutionSettings {
        /**
         * Adverse price offset applied to emulate market orders with IOC limits.
         */
        @Positive
        private BigDecimal marketableOffsetPct = new BigDecimal("0.01");

        @Min(1)
        private int protectiveOrderExpiryDays = 30;

        private MarginMode marginMode = MarginMode.CROSS;
    }
}
