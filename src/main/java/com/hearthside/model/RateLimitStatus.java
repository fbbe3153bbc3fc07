package com.hearthside.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-tier used/remaining/reset snapshot for one caller.
 */
@Value
@Builder
public class RateLimitStatus {
    TierStatus minute;
    TierStatus hour;
    TierStatus day;

    public TierStatus tier(RateTier tier) {
        switch (tier) {
            case MINUTE:
                return minute;
            case HOUR:
                return hour;
            default:
                return day;
        }
    }
}
