package com.greenwashradar.pipeline.service.resilience;

import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.exception.DocumentNotFoundException;
import com.greenwashradar.pipeline.exception.FetchException;
import com.greenwashradar.pipeline.exception.MalformedOutputException;
import com.greenwashradar.pipeline.exception.OracleCallException;
import com.greenwashradar.pipeline.exception.OracleUnavailableException;
import com.greenwashradar.pipeline.exception.RateLimitedException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Retry, circuit breaker and rate limiter around blocking calls to external dependencies.
 * <p>
 * One set of Resilience4j instances exists per dependency name and is shared by every job,
 * so the breaker state and the rate limit are global. Order from the outside in:
 * retry, rate limiter, circuit breaker, call. Every attempt takes a permit. A call refused
 * locally by the limiter never reaches the breaker, so only remote failures count against it.
 * Calls rejected by the limiter or by an open breaker are not retried.
 */
@Component
@Slf4j
public class ExternalCallPolicy {

    private final PipelineProperties properties;
    private final RetryRegistry retryRegistry = RetryRegistry.ofDefaults();
    private final CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
    private final RateLimiterRegistry rateLimiterRegistry = RateLimiterRegistry.ofDefaults();
    private final Map<String, Guard> guards = new ConcurrentHashMap<>();

    public ExternalCallPolicy(PipelineProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs the call under the policy of the named dependency.
     *
     * @throws OracleUnavailableException when the circuit is open
     * @throws RateLimitedException when no local permit was granted in time
     * @throws RuntimeException the last failure once retries are exhausted, unchanged
     */
    public <T> T execute(String dependency, Supplier<T> call) {
        Guard guard = guards.computeIfAbsent(dependency, this::createGuard);
        Supplier<T> guarded = CircuitBreaker.decorateSupplier(guard.circuitBreaker(), call);
        if (guard.rateLimiter() != null) {
            guarded = RateLimiter.decorateSupplier(guard.rateLimiter(), guarded);
        }
        Supplier<T> decorated = Retry.decorateSupplier(guard.retry(), guarded);
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            throw OracleUnavailableException.circuitOpen(dependency);
        } catch (RequestNotPermitted e) {
            throw RateLimitedException.noPermit(dependency);
        }
    }

    public CircuitBreaker.State circuitState(String dependency) {
        return guards.computeIfAbsent(dependency, this::createGuard).circuitBreaker().getState();
    }

    /**
     * Failures worth another attempt and counted against the circuit.
     */
    static boolean isTransient(Throwable e) {
        if (e instanceof OracleCallException oce) {
            return oce.isTransientFailure();
        }
        if (e instanceof FetchException fe) {
            return fe.isTransientFailure();
        }
        return e instanceof RateLimitedException
                || e instanceof TimeoutException
                || e.getCause() instanceof TimeoutException;
    }

    private Guard createGuard(String dependency) {
        PipelineProperties.CallSettings settings = properties.callSettings(dependency);

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff(), settings.getBackoffMultiplier()))
                .retryOnException(ExternalCallPolicy::isTransient)
                .build();
        Retry retry = retryRegistry.retry(dependency, retryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} (attempt {}): {}", dependency,
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));

        // every call in a window of N failing means N consecutive failures
        int threshold = Math.max(1, settings.getFailureThreshold());
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(settings.getOpenDuration())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordException(ExternalCallPolicy::isTransient)
                .ignoreExceptions(MalformedOutputException.class, DocumentNotFoundException.class)
                .build();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(dependency, breakerConfig);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Circuit breaker for {} moved {}", dependency, event.getStateTransition()));

        RateLimiter rateLimiter = null;
        if (settings.getRateLimitPerPeriod() > 0) {
            RateLimiterConfig limiterConfig = RateLimiterConfig.custom()
                    .limitForPeriod(settings.getRateLimitPerPeriod())
                    .limitRefreshPeriod(settings.getRateLimitPeriod())
                    .timeoutDuration(settings.getRateLimitWait())
                    .build();
            rateLimiter = rateLimiterRegistry.rateLimiter(dependency, limiterConfig);
        }

        log.info("Call policy for {}: attempts={}, failureThreshold={}, open={}, ratePerPeriod={}",
                dependency, settings.getMaxAttempts(), threshold, settings.getOpenDuration(),
                settings.getRateLimitPerPeriod());
        return new Guard(retry, circuitBreaker, rateLimiter);
    }

    private record Guard(Retry retry, CircuitBreaker circuitBreaker, RateLimiter rateLimiter) {
    }
}
