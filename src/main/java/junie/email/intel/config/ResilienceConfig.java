package junie.email.intel.config;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import junie.email.intel.service.AiAnalysisClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One breaker guards every model call made by this process. Each call is bounded by the
 * time limiter, and the retry repeats failed calls on the same model with exponential backoff.
 */
@Slf4j
@Configuration
public class ResilienceConfig {
    public static final String AI_BREAKER = "aiAnalysis";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public CircuitBreaker aiCircuitBreaker(CircuitBreakerRegistry registry, AiInvocationProperties properties) {
        CircuitBreaker breaker = registry.circuitBreaker(AI_BREAKER, breakerConfig(properties.getBreaker()));
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("AI circuit breaker {}: {}", event.getCircuitBreakerName(), event.getStateTransition()));
        return breaker;
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    @Bean
    public TimeLimiter aiTimeLimiter(TimeLimiterRegistry registry, AiInvocationProperties properties) {
        return registry.timeLimiter(AI_BREAKER, timeLimiterConfig(properties));
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public Retry aiRetry(RetryRegistry registry, AiInvocationProperties properties) {
        Retry retry = registry.retry(AI_BREAKER, retryConfig(properties));
        retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying AI call, attempt {} after {}", event.getNumberOfRetryAttempts(), event.getWaitInterval()));
        return retry;
    }

    /**
     * Cancelling the timed-out future interrupts the thread making the call.
     */
    public static TimeLimiterConfig timeLimiterConfig(AiInvocationProperties properties) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(properties.getCallTimeout())
                .cancelRunningFuture(true)
                .build();
    }

    /**
     * Attempts per model, waiting base * 2^(n-1) between them. A quota error or an open
     * breaker ends the model's attempts at once.
     */
    public static RetryConfig retryConfig(AiInvocationProperties properties) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.getBackoffBase(), 2))
                .ignoreExceptions(AiAnalysisClient.QuotaException.class, CallNotPermittedException.class,
                        InterruptedException.class)
                .build();
    }

    /**
     * Opens after N consecutive failures: a window of N calls that must all fail.
     * After the cooldown a single trial call decides between closing and reopening.
     */
    public static CircuitBreakerConfig breakerConfig(AiInvocationProperties.Breaker breaker) {
        int threshold = Math.max(1, breaker.getFailureThreshold());
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100)
                .waitDurationInOpenState(breaker.getCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}
