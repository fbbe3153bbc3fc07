package com.hearthside.service.budget;

import com.hearthside.config.HearthsideProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Token estimation and pricing.
 */
@Component
public class CostModel {

    public static final int COST_SCALE = 6;

    private static final double CHARS_PER_TOKEN = 1.5;
    private static final BigDecimal TOKENS_PER_UNIT = BigDecimal.valueOf(1000);

    private final BigDecimal pricePerThousand;

    public CostModel(HearthsideProperties properties) {
        this.pricePerThousand = properties.getBudget().getTokenCost();
    }

    /**
     * Rough pre-call estimate: one token per 1.5 characters of prompt plus context, rounded up.
     */
    public int estimateTokens(String prompt, String context) {
        int length = (prompt != null ? prompt.length() : 0) + (context != null ? context.length() : 0);
        return (int) Math.ceil(length / CHARS_PER_TOKEN);
    }

    public BigDecimal costOf(int tokens) {
        return BigDecimal.valueOf(tokens)
                .multiply(pricePerThousand)
                .divide(TOKENS_PER_UNIT, COST_SCALE, RoundingMode.HALF_UP);
    }
}
