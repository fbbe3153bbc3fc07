package com.hearthside.service.budget;

import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.BudgetDecision;
import com.hearthside.model.BudgetUsage;
import com.hearthside.model.CallerKey;
import com.hearthside.model.RequestCategory;
import com.hearthside.model.UsageRecord;
import com.hearthside.model.dto.TenantBudgetStatistics;
import com.hearthside.model.dto.TenantBudgetStatistics.CallerUsage;
import com.hearthside.model.dto.TenantBudgetStatistics.CategoryUsage;
import com.hearthside.model.dto.TenantBudgetStatistics.PeriodUsage;
import com.hearthside.service.concurrency.PeriodicSweep;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Daily and monthly spend per caller, and per tenant when tenant ceilings are configured.
 *
 * Only successful provider calls are debited, using actual token counts. The pre-call
 * check works on an estimate, so a caller can end a period slightly above its ceiling.
 */
@Slf4j
@Service
public class BudgetTracker {

    private static final int TOP_N = 10;

    private final ConcurrentMap<CallerKey, BudgetLedger> callerLedgers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BudgetLedger> tenantLedgers = new ConcurrentHashMap<>();
    private final Deque<UsageRecord> records = new ConcurrentLinkedDeque<>();

    private final CostModel costModel;
    private final HearthsideProperties.BudgetConfig config;
    private final Clock clock;
    private final PeriodicSweep cleanup;

    public BudgetTracker(CostModel costModel, HearthsideProperties properties, Clock clock) {
        this.costModel = costModel;
        this.config = properties.getBudget();
        this.clock = clock;
        this.cleanup = new PeriodicSweep("usage-record-cleanup", config.getCleanupInterval(), this::cleanupOldRecords);
    }

    @PostConstruct
    public void start() {
        cleanup.start();
    }

    @PreDestroy
    public void stop() {
        cleanup.stop();
    }

    /**
     * Check whether a call of roughly {@code estimatedTokens} fits the remaining budget.
     *
     * Order: caller daily, caller monthly, tenant daily, tenant monthly. The first
     * ceiling the projection would exceed refuses the call.
     */
    public BudgetDecision canAfford(CallerKey callerKey, int estimatedTokens) {
        BigDecimal estimatedCost = costModel.costOf(estimatedTokens);
        BudgetUsage usage = usage(callerKey);

        BigDecimal projectedDaily = usage.getDailyUsed().add(estimatedCost);
        BigDecimal projectedMonthly = usage.getMonthlyUsed().add(estimatedCost);

        if (projectedDaily.compareTo(config.getDailyLimit()) > 0) {
            return refuse(callerKey, usage, String.format("Daily budget exceeded: used %s of %s",
                    usage.getDailyUsed().toPlainString(), config.getDailyLimit().toPlainString()));
        }
        if (projectedMonthly.compareTo(config.getMonthlyLimit()) > 0) {
            return refuse(callerKey, usage, String.format("Monthly budget exceeded: used %s of %s",
                    usage.getMonthlyUsed().toPlainString(), config.getMonthlyLimit().toPlainString()));
        }

        if (hasTenantCeilings()) {
            BudgetUsage tenant = tenantUsage(callerKey.getTenantId());
            if (config.getTenantDailyLimit() != null
                    && tenant.getDailyUsed().add(estimatedCost).compareTo(config.getTenantDailyLimit()) > 0) {
                return refuse(callerKey, usage, String.format("Family daily budget exceeded: used %s of %s",
                        tenant.getDailyUsed().toPlainString(), config.getTenantDailyLimit().toPlainString()));
            }
            if (config.getTenantMonthlyLimit() != null
                    && tenant.getMonthlyUsed().add(estimatedCost).compareTo(config.getTenantMonthlyLimit()) > 0) {
                return refuse(callerKey, usage, String.format("Family monthly budget exceeded: used %s of %s",
                        tenant.getMonthlyUsed().toPlainString(), config.getTenantMonthlyLimit().toPlainString()));
            }
        }

        BigDecimal warningLevel = config.getDailyLimit().multiply(BigDecimal.valueOf(config.getWarningThreshold()));
        if (projectedDaily.compareTo(warningLevel) > 0) {
            log.warn("Budget warning: caller={} projected daily spend {} is over {}% of {}",
                    callerKey, projectedDaily.toPlainString(),
                    Math.round(config.getWarningThreshold() * 100), config.getDailyLimit().toPlainString());
        }

        return BudgetDecision.builder()
                .allowed(true)
                .usage(usage)
                .build();
    }

    /**
     * Debit a successful call.
     *
     * @return the appended usage record
     */
    public UsageRecord recordUsage(CallerKey callerKey, RequestCategory category, int tokens, String requestId) {
        BigDecimal cost = costModel.costOf(tokens);
        LocalDate today = today();

        callerLedgers.compute(callerKey, (key, ledger) -> debit(ledger, today, tokens, cost));
        tenantLedgers.compute(callerKey.getTenantId(), (key, ledger) -> debit(ledger, today, tokens, cost));

        UsageRecord record = UsageRecord.builder()
                .id(UUID.randomUUID().toString())
                .callerId(callerKey.getCallerId())
                .tenantId(callerKey.getTenantId())
                .category(category)
                .tokens(tokens)
                .cost(cost)
                .requestId(requestId)
                .timestamp(clock.instant())
                .build();
        records.addLast(record);

        log.debug("Recorded AI usage: caller={}, category={}, tokens={}, cost={}",
                callerKey, category != null ? category.getValue() : null, tokens, cost.toPlainString());
        return record;
    }

    /**
     * Current day and month figures for a caller.
     */
    public BudgetUsage usage(CallerKey callerKey) {
        return snapshot(callerLedgers, callerKey, config.getDailyLimit(), config.getMonthlyLimit());
    }

    /**
     * Family-wide figures. Remaining amounts are null when no tenant ceiling is configured.
     */
    public BudgetUsage tenantUsage(String tenantId) {
        return snapshot(tenantLedgers, tenantId, config.getTenantDailyLimit(), config.getTenantMonthlyLimit());
    }

    /**
     * Usage records of a tenant, newest first.
     *
     * @param from first day to include, or null
     * @param to last day to include, or null
     * @param limit maximum number of records
     */
    public List<UsageRecord> records(String tenantId, LocalDate from, LocalDate to, int limit) {
        return recordsNewestFirst()
                .filter(record -> record.getTenantId().equals(tenantId))
                .filter(record -> within(record, from, to))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    public TenantBudgetStatistics tenantStatistics(String tenantId) {
        LocalDate today = today();
        LocalDate weekStart = today.minusDays(6);
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate earliest = weekStart.isBefore(monthStart) ? weekStart : monthStart;

        List<UsageRecord> tenantRecords = recordsNewestFirst()
                .filter(record -> record.getTenantId().equals(tenantId))
                .filter(record -> within(record, earliest, today))
                .collect(Collectors.toList());

        List<UsageRecord> thisMonth = tenantRecords.stream()
                .filter(record -> within(record, monthStart, today))
                .collect(Collectors.toList());

        return TenantBudgetStatistics.builder()
                .tenantId(tenantId)
                .today(period(tenantRecords, today, today))
                .week(period(tenantRecords, weekStart, today))
                .month(period(tenantRecords, monthStart, today))
                .topCategories(top(thisMonth, record -> record.getCategory() != null ? record.getCategory().getValue() : "unknown")
                        .stream()
                        .map(group -> CategoryUsage.builder()
                                .category(group.key)
                                .count(group.count)
                                .cost(group.cost)
                                .build())
                        .collect(Collectors.toList()))
                .topCallers(top(thisMonth, UsageRecord::getCallerId)
                        .stream()
                        .map(group -> CallerUsage.builder()
                                .callerId(group.key)
                                .count(group.count)
                                .cost(group.cost)
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * Drop usage records older than the retention period.
     *
     * @return number of records removed
     */
    public int cleanupOldRecords() {
        Instant cutoff = clock.instant().minus(config.getRecordRetention());
        int removed = 0;

        Iterator<UsageRecord> it = records.iterator();
        while (it.hasNext()) {
            if (it.next().getTimestamp().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }

        if (removed > 0) {
            log.info("Removed {} usage records older than {}", removed, config.getRecordRetention());
        }
        return removed;
    }

    public int recordCount() {
        return records.size();
    }

    private boolean hasTenantCeilings() {
        return config.getTenantDailyLimit() != null || config.getTenantMonthlyLimit() != null;
    }

    private BudgetDecision refuse(CallerKey callerKey, BudgetUsage usage, String reason) {
        log.debug("Budget refused: caller={}, reason={}", callerKey, reason);
        return BudgetDecision.builder()
                .allowed(false)
                .reason(reason)
                .usage(usage)
                .build();
    }

    private BudgetLedger debit(BudgetLedger ledger, LocalDate today, int tokens, BigDecimal cost) {
        BudgetLedger current = ledger != null ? ledger : new BudgetLedger(today);
        current.rollover(today);
        current.add(tokens, cost);
        return current;
    }

    private <K> BudgetUsage snapshot(ConcurrentMap<K, BudgetLedger> ledgers, K key,
                                 BigDecimal dailyLimit, BigDecimal monthlyLimit) {
        LocalDate today = today();
        BudgetUsage[] usage = new BudgetUsage[1];

        ledgers.computeIfPresent(key, (k, ledger) -> {
            ledger.rollover(today);
            usage[0] = ledger.toUsage(dailyLimit, monthlyLimit);
            return ledger;
        });

        return usage[0] != null ? usage[0] : new BudgetLedger(today).toUsage(dailyLimit, monthlyLimit);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), config.getZone());
    }

    private LocalDate dayOf(UsageRecord record) {
        return LocalDate.ofInstant(record.getTimestamp(), config.getZone());
    }

    private boolean within(UsageRecord record, LocalDate from, LocalDate to) {
        LocalDate day = dayOf(record);
        return (from == null || !day.isBefore(from)) && (to == null || !day.isAfter(to));
    }

    private Stream<UsageRecord> recordsNewestFirst() {
        Iterable<UsageRecord> newestFirst = records::descendingIterator;
        return StreamSupport.stream(newestFirst.spliterator(), false);
    }

    private PeriodUsage period(List<UsageRecord> source, LocalDate from, LocalDate to) {
        List<UsageRecord> inPeriod = source.stream()
                .filter(record -> within(record, from, to))
                .collect(Collectors.toList());

        BigDecimal cost = inPeriod.stream().map(UsageRecord::getCost).reduce(BigDecimal.ZERO, BigDecimal::add);
        long tokens = inPeriod.stream().mapToLong(UsageRecord::getTokens).sum();

        return PeriodUsage.builder()
                .from(from)
                .to(to)
                .cost(cost)
                .tokens(tokens)
                .requests(inPeriod.size())
                .averageCost(inPeriod.isEmpty() ? BigDecimal.ZERO
                        : cost.divide(BigDecimal.valueOf(inPeriod.size()), CostModel.COST_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    private List<Group> top(List<UsageRecord> source, Function<UsageRecord, String> keyOf) {
        Map<String, Group> groups = new HashMap<>();
        for (UsageRecord record : source) {
            groups.computeIfAbsent(keyOf.apply(record), Group::new).add(record);
        }
        return groups.values().stream()
                .sorted(Comparator.comparing((Group group) -> group.cost).reversed())
                .limit(TOP_N)
                .collect(Collectors.toList());
    }

    private static final class Group {
        private final String key;
        private long count;
        private BigDecimal cost = BigDecimal.ZERO;

        private Group(String key) {
            this.key = key;
        }

        private void add(UsageRecord record) {
            count++;
            cost = cost.add(record.getCost());
        }
    }
}
