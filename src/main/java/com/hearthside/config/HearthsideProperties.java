package com.hearthside.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the AI gateway.
 */
@Data
@Component
@ConfigurationProperties(prefix = "hearthside.ai")
public class HearthsideProperties {

    /**
     * Feature switch. When off, every request fails with a validation error.
     */
    private boolean enabled = true;

    private ModelConfig model = new ModelConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CacheConfig cache = new CacheConfig();
    private BudgetConfig budget = new BudgetConfig();

    /**
     * The pipeline only runs when switched on and a provider key is configured.
     */
    public boolean isOperational() {
        return enabled && model.getApiKey() != null && !model.getApiKey().isBlank();
    }

    @Data
    public static class ModelConfig {
        /**
         * "dashscope" or "openai".
         */
        private String provider = "dashscope";
        private String baseUrl = "https://dashscope.aliyuncs.com/api/v1";
        private String apiKey;
        private String name = "qwen-plus";
        private int maxTokens = 2000;
        private double temperature = 0.7;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimitConfig {
        private int requestsPerMinute = 10;
        private int requestsPerHour = 100;
        private int requestsPerDay = 1000;
        private Duration cleanupInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private int maxSize = 1000;
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class BudgetConfig {
        /**
         * Price per 1000 tokens.
         */
        private BigDecimal tokenCost = new BigDecimal("0.002");
        private BigDecimal dailyLimit = new BigDecimal("10.0");
        private BigDecimal monthlyLimit = new BigDecimal("200.0");

        /**
         * Optional family-wide ceilings; null disables the tenant check.
         */
        private BigDecimal tenantDailyLimit;
        private BigDecimal tenantMonthlyLimit;

        private double warningThreshold = 0.9;
        private ZoneId zone = ZoneId.of("UTC");
        private Duration recordRetention = Duration.ofDays(90);
        private Duration cleanupInterval = Duration.ofHours(1);
    }
}
