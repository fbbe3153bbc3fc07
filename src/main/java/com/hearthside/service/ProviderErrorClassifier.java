package com.hearthside.service;

import com.hearthside.model.ErrorKind;
import com.hearthside.model.ServiceError;
import com.hearthside.provider.ProviderException;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Maps model-call failures to client-visible errors.
 *
 * Rules are evaluated in order and the first match wins; anything no rule claims is
 * treated as a network failure.
 */
@Component
public class ProviderErrorClassifier {

    static final String DETAIL_PROVIDER_STATUS = "providerStatus";

    private final List<Rule> rules = List.of(
            new Rule("auth",
                    e -> e.hasStatus() && (e.getStatus() == 401 || e.getStatus() == 403),
                    e -> error(e, ServiceError.API_AUTH_ERROR, "AI provider rejected the credentials",
                            ErrorKind.API_ERROR, false)),
            new Rule("upstream-rate-limit",
                    e -> e.hasStatus() && e.getStatus() == 429,
                    e -> error(e, ServiceError.API_RATE_LIMIT, "AI provider rate limit reached, try again later",
                            ErrorKind.RATE_LIMIT, true)),
            new Rule("server",
                    e -> e.hasStatus() && e.getStatus() >= 500,
                    e -> error(e, ServiceError.API_SERVER_ERROR, "AI provider is temporarily unavailable",
                            ErrorKind.API_ERROR, true)),
            new Rule("other-status",
                    ProviderException::hasStatus,
                    e -> error(e, ServiceError.API_REQUEST_FAILED, "AI provider request failed",
                            ErrorKind.API_ERROR, false)),
            new Rule("malformed",
                    e -> e.getReason() == ProviderException.Reason.MALFORMED_RESPONSE,
                    e -> error(e, ServiceError.API_INVALID_RESPONSE, "AI provider returned an unusable response",
                            ErrorKind.API_ERROR, true))
    );

    public ServiceError classify(Throwable failure) {
        Throwable cause = Exceptions.unwrap(failure);
        if (cause instanceof ProviderException) {
            ProviderException providerFailure = (ProviderException) cause;
            for (Rule rule : rules) {
                if (rule.matches.test(providerFailure)) {
                    return rule.toError.apply(providerFailure);
                }
            }
        }
        return ServiceError.of(ServiceError.NETWORK_ERROR, "Could not reach the AI provider",
                ErrorKind.NETWORK_ERROR, true);
    }

    /**
     * Rule names in evaluation order.
     */
    List<String> ruleNames() {
        return rules.stream().map(rule -> rule.name).collect(Collectors.toList());
    }

    private static ServiceError error(ProviderException e, String code, String message,
                                      ErrorKind kind, boolean retryable) {
        ServiceError.ServiceErrorBuilder builder = ServiceError.builder()
                .code(code)
                .message(message)
                .kind(kind)
                .retryable(retryable);
        if (e.hasStatus()) {
            builder.detail(DETAIL_PROVIDER_STATUS, e.getStatus());
        }
        return builder.build();
    }

    private static final class Rule {
        private final String name;
        private final Predicate<ProviderException> matches;
        private final Function<ProviderException, ServiceError> toError;

        private Rule(String name, Predicate<ProviderException> matches,
                     Function<ProviderException, ServiceError> toError) {
            this.name = name;
            this.matches = matches;
            this.toError = toError;
        }
    }
}
