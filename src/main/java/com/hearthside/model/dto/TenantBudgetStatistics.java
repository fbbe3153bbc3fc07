package com.hearthside.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Family-wide spend breakdown built from usage records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantBudgetStatistics {

    private String tenantId;

    private PeriodUsage today;

    /**
     * Last seven days including today.
     */
    private PeriodUsage week;

    /**
     * First day of the current month through today.
     */
    private PeriodUsage month;

    /**
     * Up to ten categories by cost this month.
     */
    private List<CategoryUsage> topCategories;

    /**
     * Up to ten callers by cost this month.
     */
    private List<CallerUsage> topCallers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeriodUsage {
        private LocalDate from;
        private LocalDate to;
        private BigDecimal cost;
        private long tokens;
        private long requests;
        private BigDecimal averageCost;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryUsage {
        private String category;
        private long count;
        private BigDecimal cost;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CallerUsage {
        private String callerId;
        private long count;
        private BigDecimal cost;
    }
}
