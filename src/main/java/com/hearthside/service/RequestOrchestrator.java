package com.hearthside.service;

import com.hearthside.config.HearthsideProperties;
import com.hearthside.model.AiRequest;
import com.hearthside.model.AiResponse;
import com.hearthside.model.AiResult;
import com.hearthside.model.BudgetDecision;
import com.hearthside.model.BudgetUsage;
import com.hearthside.model.CallerKey;
import com.hearthside.model.ChatMessage;
import com.hearthside.model.ErrorKind;
import com.hearthside.model.Fingerprint;
import com.hearthside.model.ModelCompletion;
import com.hearthside.model.RateLimitDecision;
import com.hearthside.model.RateLimitStatus;
import com.hearthside.model.ServiceError;
import com.hearthside.model.dto.CacheEntrySummary;
import com.hearthside.model.dto.CacheStatistics;
import com.hearthside.model.dto.ServiceStatus;
import com.hearthside.provider.ModelClient;
import com.hearthside.provider.ProviderException;
import com.hearthside.service.budget.BudgetTracker;
import com.hearthside.service.budget.CostModel;
import com.hearthside.service.cache.CacheEntry;
import com.hearthside.service.cache.ResponseCache;
import com.hearthside.service.concurrency.CallerLocks;
import com.hearthside.service.concurrency.InFlightRequests;
import com.hearthside.service.concurrency.InFlightRequests.Reservation;
import com.hearthside.service.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one AI request through the gating pipeline.
 *
 * Flow:
 * 1. Feature switch and input validation
 * 2. Rate check
 * 3. Cache lookup; a hit is counted against the rate limit and returned, free of charge
 * 4. Budget check on a token estimate
 * 5. Provider call
 * 6. Debit actual usage, cache the response, count the request
 *
 * Steps 2-4 and step 6 each run under the caller's lock, so two requests of the same
 * caller never interleave their checks and records. The lock is not held during the
 * provider call; an admitted call is instead reserved in {@link InFlightRequests} and
 * counted by the caller's later rate and budget checks until it settles. Every failure
 * is returned as a {@link ServiceError}; the returned Mono never errors.
 */
@Slf4j
@Service
public class RequestOrchestrator {

    private final HearthsideProperties properties;
    private final RequestValidator validator;
    private final RateLimiter rateLimiter;
    private final ResponseCache responseCache;
    private final BudgetTracker budgetTracker;
    private final CostModel costModel;
    private final ModelClient modelClient;
    private final ProviderErrorClassifier errorClassifier;
    private final CallerLocks callerLocks;
    private final InFlightRequests inFlightRequests;
    private final Clock clock;
    private final Scheduler scheduler;

    public RequestOrchestrator(HearthsideProperties properties,
                               RequestValidator validator,
                               RateLimiter rateLimiter,
                               ResponseCache responseCache,
                               BudgetTracker budgetTracker,
                               CostModel costModel,
                               ModelClient modelClient,
                               ProviderErrorClassifier errorClassifier,
                               CallerLocks callerLocks,
                               InFlightRequests inFlightRequests,
                               Clock clock) {
        this.properties = properties;
        this.validator = validator;
        this.rateLimiter = rateLimiter;
        this.responseCache = responseCache;
        this.budgetTracker = budgetTracker;
        this.costModel = costModel;
        this.modelClient = modelClient;
        this.errorClassifier = errorClassifier;
        this.callerLocks = callerLocks;
        this.inFlightRequests = inFlightRequests;
        this.clock = clock;
        this.scheduler = Schedulers.boundedElastic();
    }

    /**
     * Process a request off the calling thread. No worker thread is held while the
     * provider call is outstanding.
     *
     * @return the response or the error; never an error signal
     */
    public Mono<AiResult> handle(AiRequest request) {
        Execution execution = new Execution(request);
        return Mono.fromCallable(() -> admit(execution))
                .subscribeOn(scheduler)
                .flatMap(admitted -> admitted.map(Mono::just).orElseGet(() -> callModel(execution)))
                .onErrorResume(e -> {
                    log.error("Unexpected error in AI request pipeline: caller={}, state={}",
                            execution.callerKey(), execution.state, e);
                    return Mono.just(execution.fail(ServiceError.unknown()));
                });
    }

    /**
     * Process a request and wait for the result. Blocks for the duration of the provider call.
     */
    public AiResult process(AiRequest request) {
        return handle(request).block();
    }

    /**
     * Everything before the provider call.
     *
     * @return the final result, or empty when the request was admitted to the provider
     */
    private Optional<AiResult> admit(Execution execution) {
        if (!properties.isOperational()) {
            return Optional.of(execution.fail(ServiceError.disabled()));
        }

        Optional<String> problem = validator.validate(execution.request);
        if (problem.isPresent()) {
            return Optional.of(execution.fail(ServiceError.invalidRequest(problem.get())));
        }

        return callerLocks.withLock(execution.request.callerKey(), () -> gate(execution));
    }

    private Optional<AiResult> gate(Execution execution) {
        AiRequest request = execution.request;
        CallerKey callerKey = request.callerKey();
        Reservation pending = inFlightRequests.current(callerKey);

        RateLimitDecision rateDecision = rateLimiter.check(callerKey, pending.getRequests());
        if (!rateDecision.isAllowed()) {
            return Optional.of(execution.fail(ServiceError.builder()
                    .code(ServiceError.RATE_LIMIT_EXCEEDED)
                    .message(rateDecision.getReason())
                    .kind(ErrorKind.RATE_LIMIT)
                    .retryable(true)
                    .detail("tier", rateDecision.getTier().getLabel())
                    .detail("resetAt", rateDecision.getStatus().tier(rateDecision.getTier()).getResetAt())
                    .build()));
        }
        execution.advance(PipelineState.RATE_CHECKED);

        execution.fingerprint = responseCache.fingerprint(request);
        Optional<CacheEntry> cached = responseCache.lookup(execution.fingerprint);
        execution.advance(PipelineState.CACHE_CHECKED);

        if (cached.isPresent()) {
            execution.advance(PipelineState.CACHE_HIT);
            return Optional.of(serveFromCache(execution, execution.fingerprint, cached.get()));
        }
        execution.advance(PipelineState.CACHE_MISS);

        int estimatedTokens = costModel.estimateTokens(request.getPrompt(), request.getContext());
        BudgetDecision budgetDecision = budgetTracker.canAfford(callerKey, estimatedTokens + pending.getTokens());
        if (!budgetDecision.isAllowed()) {
            return Optional.of(execution.fail(ServiceError.budgetExceeded(budgetDecision.getReason())));
        }

        inFlightRequests.reserve(callerKey, estimatedTokens);
        execution.estimatedTokens = estimatedTokens;
        execution.reserved.set(true);
        execution.advance(PipelineState.BUDGET_CHECKED);
        return Optional.empty();
    }

    private Mono<AiResult> callModel(Execution execution) {
        AiRequest request = execution.request;
        execution.advance(PipelineState.CALLING);

        Mono<ModelCompletion> call = Mono.defer(() -> modelClient.invoke(buildMessages(request),
                        request.effectiveMaxTokens(properties.getModel().getMaxTokens()),
                        request.effectiveTemperature(properties.getModel().getTemperature())))
                .switchIfEmpty(Mono.error(() -> ProviderException.malformed("Provider returned no completion")))
                .onErrorMap(ModelCallFailure::new);

        return call
                .publishOn(scheduler)
                .map(completion -> callerLocks.withLock(request.callerKey(), () -> settle(execution, completion)))
                .onErrorResume(ModelCallFailure.class, failure -> Mono.just(callFailed(execution, failure.getCause())))
                .doFinally(signal -> releaseReservation(execution));
    }

    private AiResult callFailed(Execution execution, Throwable error) {
        releaseReservation(execution);
        log.debug("Provider call failed: caller={}, provider={}", execution.callerKey(), modelClient.getName(), error);
        return execution.fail(errorClassifier.classify(error));
    }

    private AiResult settle(Execution execution, ModelCompletion completion) {
        AiRequest request = execution.request;
        CallerKey callerKey = request.callerKey();

        // Some providers omit usage; bill the estimate rather than nothing.
        int tokens = completion.getTokensUsed() > 0 ? completion.getTokensUsed() : execution.estimatedTokens;
        String requestId = completion.getProviderRequestId() != null
                ? completion.getProviderRequestId()
                : generateRequestId();

        try {
            budgetTracker.recordUsage(callerKey, request.getCategory(), tokens, requestId);
            execution.advance(PipelineState.USAGE_RECORDED);

            responseCache.store(execution.fingerprint, completion.getText(), tokens);
            execution.advance(PipelineState.CACHE_STORED);

            rateLimiter.record(callerKey);
            execution.advance(PipelineState.RECORDED);
        } finally {
            releaseReservation(execution);
        }

        AiResponse response = AiResponse.builder()
                .content(completion.getText())
                .tokenCount(tokens)
                .cost(costModel.costOf(tokens))
                .requestId(requestId)
                .servedFromCache(false)
                .timestamp(clock.instant())
                .build();

        return execution.succeed(response);
    }

    private void releaseReservation(Execution execution) {
        if (execution.reserved.compareAndSet(true, false)) {
            inFlightRequests.release(execution.callerKey(), execution.estimatedTokens);
        }
    }

    private AiResult serveFromCache(Execution execution, Fingerprint fingerprint, CacheEntry entry) {
        rateLimiter.record(execution.callerKey());
        execution.advance(PipelineState.RECORDED);

        AiResponse response = AiResponse.builder()
                .content(entry.getContent())
                .tokenCount(entry.getTokenCount())
                .cost(BigDecimal.ZERO)
                .requestId("cached_" + fingerprint.getValue().substring(0, 8))
                .servedFromCache(true)
                .timestamp(entry.getCreatedAt())
                .build();

        return execution.succeed(response);
    }

    /**
     * System prompt for the category, then the context as its own user turn, then the prompt.
     */
    List<ChatMessage> buildMessages(AiRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(request.getCategory().getSystemPrompt()));
        if (request.hasContext()) {
            messages.add(ChatMessage.user("Context: " + request.getContext()));
        }
        messages.add(ChatMessage.user(request.getPrompt()));
        return messages;
    }

    private String generateRequestId() {
        return "ai_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public void clearCache() {
        responseCache.clear();
    }

    public void resetCallerRateLimit(CallerKey callerKey) {
        rateLimiter.reset(callerKey);
    }

    public CacheStatistics cacheStatistics() {
        return responseCache.stats();
    }

    public List<CacheEntrySummary> cacheEntries(int limit) {
        return responseCache.entries(limit);
    }

    public RateLimitStatus rateLimitStatus(CallerKey callerKey) {
        return rateLimiter.status(callerKey);
    }

    public BudgetUsage budgetUsage(CallerKey callerKey) {
        return budgetTracker.usage(callerKey);
    }

    /**
     * Everything a client dashboard shows; only the switch when the feature is off.
     */
    public ServiceStatus serviceStatus(CallerKey callerKey) {
        if (!properties.isOperational()) {
            return ServiceStatus.builder().enabled(false).build();
        }
        return ServiceStatus.builder()
                .enabled(true)
                .budgetUsage(budgetTracker.usage(callerKey))
                .cacheStats(responseCache.stats())
                .rateLimitStatus(rateLimiter.status(callerKey))
                .build();
    }

    /**
     * Tracks how far one request got, for the failure log line.
     */
    private final class Execution {
        private final AiRequest request;
        private final long startNanos = System.nanoTime();
        private final AtomicBoolean reserved = new AtomicBoolean();
        private volatile PipelineState state = PipelineState.RECEIVED;
        private volatile Fingerprint fingerprint;
        private volatile int estimatedTokens;

        private Execution(AiRequest request) {
            this.request = request;
        }

        private CallerKey callerKey() {
            return request != null ? request.callerKey() : null;
        }

        private void advance(PipelineState next) {
            log.trace("AI request {} -> {}: caller={}", state, next, callerKey());
            state = next;
        }

        private AiResult fail(ServiceError error) {
            log.warn("AI request failed: caller={}, category={}, state={}, code={}, kind={}, retryable={}",
                    callerKey(),
                    request != null && request.getCategory() != null ? request.getCategory().getValue() : null,
                    state, error.getCode(), error.getKind().getValue(), error.isRetryable());
            state = PipelineState.FAILED;
            return AiResult.failure(error);
        }

        private AiResult succeed(AiResponse response) {
            advance(PipelineState.DONE);
            log.info("AI request completed: caller={}, category={}, cached={}, tokens={}, cost={}, duration={}ms",
                    callerKey(), request.getCategory().getValue(), response.isServedFromCache(),
                    response.getTokenCount(), response.getCost().toPlainString(),
                    (System.nanoTime() - startNanos) / 1_000_000);
            return AiResult.success(response);
        }
    }

    /**
     * Marks a failure of the provider call itself, as opposed to the bookkeeping after it.
     */
    private static final class ModelCallFailure extends RuntimeException {
        private ModelCallFailure(Throwable cause) {
            super(cause);
        }
    }
}
