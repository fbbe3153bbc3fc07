package com.hearthside.service.concurrency;

import com.hearthside.model.CallerKey;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Admitted provider calls per caller that have not been settled yet.
 *
 * A caller's lock is released while its call is in flight, so the rate and budget checks
 * of its next request add these reservations to the recorded figures.
 */
@Component
public class InFlightRequests {

    private final ConcurrentMap<CallerKey, Reservation> reservations = new ConcurrentHashMap<>();

    public Reservation current(CallerKey callerKey) {
        return reservations.getOrDefault(callerKey, Reservation.NONE);
    }

    public void reserve(CallerKey callerKey, int estimatedTokens) {
        reservations.merge(callerKey, new Reservation(1, estimatedTokens), Reservation::plus);
    }

    public void release(CallerKey callerKey, int estimatedTokens) {
        reservations.computeIfPresent(callerKey, (key, reservation) -> {
            Reservation left = reservation.minus(new Reservation(1, estimatedTokens));
            return left.getRequests() > 0 ? left : null;
        });
    }

    /**
     * Number of callers with at least one call in flight.
     */
    public int size() {
        return reservations.size();
    }

    @Value
    public static class Reservation {
        static final Reservation NONE = new Reservation(0, 0);

        int requests;
        int tokens;

        Reservation plus(Reservation other) {
            return new Reservation(requests + other.requests, tokens + other.tokens);
        }

        Reservation minus(Reservation other) {
            return new Reservation(requests - other.requests, Math.max(0, tokens - other.tokens));
        }
    }
}
