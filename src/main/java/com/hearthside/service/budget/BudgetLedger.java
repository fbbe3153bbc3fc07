package com.hearthside.service.budget;

import com.hearthside.model.BudgetUsage;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Day and month totals of one caller or tenant.
 *
 * Not thread-safe: only mutated inside {@code ConcurrentHashMap.compute} for its key.
 */
final class BudgetLedger {

    private LocalDate day;
    private YearMonth month;

    private BigDecimal dailyCost = BigDecimal.ZERO;
    private long dailyTokens;
    private long dailyRequests;

    private BigDecimal monthlyCost = BigDecimal.ZERO;
    private long monthlyTokens;
    private long monthlyRequests;

    BudgetLedger(LocalDate today) {
        this.day = today;
        this.month = YearMonth.from(today);
    }

    /**
     * Start a new day (and month) from zero if {@code today} is past the tracked period.
     */
    void rollover(LocalDate today) {
        if (!today.equals(day)) {
            day = today;
            dailyCost = BigDecimal.ZERO;
            dailyTokens = 0;
            dailyRequests = 0;
        }
        YearMonth current = YearMonth.from(today);
        if (!current.equals(month)) {
            month = current;
            monthlyCost = BigDecimal.ZERO;
            monthlyTokens = 0;
            monthlyRequests = 0;
        }
    }

    void add(int tokens, BigDecimal cost) {
        dailyCost = dailyCost.add(cost);
        dailyTokens += tokens;
        dailyRequests++;

        monthlyCost = monthlyCost.add(cost);
        monthlyTokens += tokens;
        monthlyRequests++;
    }

    BigDecimal getDailyCost() {
        return dailyCost;
    }

    BigDecimal getMonthlyCost() {
        return monthlyCost;
    }

    /**
     * @param dailyLimit null when the period has no ceiling; remaining is then null too
     */
    BudgetUsage toUsage(BigDecimal dailyLimit, BigDecimal monthlyLimit) {
        BigDecimal average = monthlyRequests == 0 ? BigDecimal.ZERO
                : monthlyCost.divide(BigDecimal.valueOf(monthlyRequests), CostModel.COST_SCALE, RoundingMode.HALF_UP);

        return BudgetUsage.builder()
                .dailyUsed(dailyCost)
                .monthlyUsed(monthlyCost)
                .dailyRemaining(remaining(dailyLimit, dailyCost))
                .monthlyRemaining(remaining(monthlyLimit, monthlyCost))
                .tokensUsed(monthlyTokens)
                .requestCount(monthlyRequests)
                .averageCost(average)
                .build();
    }

    private static BigDecimal remaining(BigDecimal limit, BigDecimal used) {
        if (limit == null) {
            return null;
        }
        return limit.subtract(used).max(BigDecimal.ZERO);
    }
}
