package junie.email.intel.service;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import junie.email.intel.config.AiInvocationProperties;
import junie.email.intel.entity.AiAnalysis;
import junie.email.intel.entity.AiUsageLog;
import junie.email.intel.entity.EmailRecord;
import junie.email.intel.model.AiAnalysisRequest;
import junie.email.intel.model.AiAnalysisResponse;
import junie.email.intel.model.AiInvocationResult;
import junie.email.intel.repository.AiUsageLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the analysis capability through the shared circuit breaker.
 * <p>
 * Models are tried in order. Each model gets the attempts of the retry policy; a quota error
 * moves straight to the next model. Every attempt takes its own breaker permission, so a
 * half-open breaker lets exactly one trial through. A call that outlives the time limiter is
 * interrupted and charged as if it had used its whole token allowance.
 */
@Slf4j
@Service
public class AiInvocationService {
    // Chat framing around the system and user messages
    private static final int MESSAGE_OVERHEAD_TOKENS = 16;

    private final AiAnalysisClient client;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final Retry retry;
    private final AiInvocationProperties properties;
    private final ModelPricing modelPricing;
    private final AiAnalysisParser parser;
    private final AnalysisPromptBuilder promptBuilder;
    private final AiUsageLogRepository usageLogRepository;
    private final ExecutorService aiCallExecutor;
    private final Clock clock;

    public AiInvocationService(AiAnalysisClient client,
                               CircuitBreaker circuitBreaker,
                               TimeLimiter timeLimiter,
                               Retry retry,
                               AiInvocationProperties properties,
                               ModelPricing modelPricing,
                               AiAnalysisParser parser,
                               AnalysisPromptBuilder promptBuilder,
                               AiUsageLogRepository usageLogRepository,
                               @Qualifier("aiCallExecutor") ExecutorService aiCallExecutor,
                               Clock clock) {
        this.client = client;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.retry = retry;
        this.properties = properties;
        this.modelPricing = modelPricing;
        this.parser = parser;
        this.promptBuilder = promptBuilder;
        this.usageLogRepository = usageLogRepository;
        this.aiCallExecutor = aiCallExecutor;
        this.clock = clock;
    }

    public AiInvocationResult analyze(EmailRecord email) {
        return invoke(email.getUserId(), email.getId(), promptBuilder.build(email));
    }

    /**
     * Whole cents {@link #analyze} can charge at most for this email: every attempt on every
     * model, each with a full completion. Never less than {@code ai.reservation-cents}.
     */
    public long reservationCents(EmailRecord email) {
        long promptTokens = promptTokenBound(promptBuilder.build(email));
        BigDecimal worst = BigDecimal.ZERO;
        for (String model : modelChain()) {
            worst = worst.add(attemptCeiling(model, promptTokens)
                    .multiply(BigDecimal.valueOf(retry.getRetryConfig().getMaxAttempts())));
        }
        return Math.max(properties.getReservationCents(), ModelPricing.chargeableCents(worst));
    }

    public AiInvocationResult invoke(String userId, String emailRecordId, String prompt) {
        Invocation invocation = new Invocation(userId, emailRecordId, promptTokenBound(prompt));

        for (String model : modelChain()) {
            AiAnalysisRequest request = AiAnalysisRequest.builder()
                    .prompt(prompt)
                    .modelHint(model)
                    .maxTokens(properties.getMaxTokens())
                    .build();
            invocation.modelAttempts = 0;
            Callable<AiAnalysis> call = Retry.decorateCallable(retry, () -> attempt(invocation, model, request));
            try {
                AiAnalysis analysis = call.call();
                return AiInvocationResult.success(analysis, invocation.spent,
                        ModelPricing.chargeableCents(invocation.spent), invocation.attempts);
            } catch (CallNotPermittedException e) {
                log.warn("Circuit breaker {} is {}, skipping AI analysis for email {}",
                        circuitBreaker.getName(), circuitBreaker.getState(), emailRecordId);
                return AiInvocationResult.breakerOpen(invocation.spent,
                        ModelPricing.chargeableCents(invocation.spent), invocation.attempts);
            } catch (AiAnalysisClient.QuotaException e) {
                log.warn("Quota exceeded for model {}, moving to next model: {}", model, e.getMessage());
            } catch (Exception e) {
                if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                    Thread.currentThread().interrupt();
                    log.warn("AI analysis for email {} interrupted", emailRecordId);
                    return AiInvocationResult.exhausted(invocation.spent,
                            ModelPricing.chargeableCents(invocation.spent), invocation.attempts, "interrupted");
                }
                log.warn("Model {} exhausted for email {}: {}", model, emailRecordId, e.getMessage());
            }
        }

        log.error("AI analysis exhausted for email {} after {} attempts: {}",
                emailRecordId, invocation.attempts, invocation.lastError);
        return AiInvocationResult.exhausted(invocation.spent, ModelPricing.chargeableCents(invocation.spent),
                invocation.attempts, invocation.lastError);
    }

    List<String> modelChain() {
        List<String> chain = new ArrayList<>();
        chain.add(properties.getPrimaryModel());
        String fallback = properties.getFallbackModel();
        if (fallback != null && !fallback.isBlank() && !fallback.equals(properties.getPrimaryModel())) {
            chain.add(fallback);
        }
        return chain;
    }

    // One call under the breaker and the time limiter; the retry decides whether another follows
    private AiAnalysis attempt(Invocation invocation, String model, AiAnalysisRequest request) throws Exception {
        if (!circuitBreaker.tryAcquirePermission()) {
            throw CallNotPermittedException.createCallNotPermittedException(circuitBreaker);
        }
        invocation.attempts++;
        int attempt = ++invocation.modelAttempts;
        String emailRecordId = invocation.emailRecordId;
        long start = System.nanoTime();
        AiAnalysisResponse response = null;
        try {
            log.debug("AI call for email {} with model {} (attempt {})", emailRecordId, model, attempt);
            response = timeLimiter.executeFutureSupplier(() -> aiCallExecutor.submit(() -> client.analyze(request)));
            AiAnalysis analysis = parser.parse(response.getContent());
            long elapsed = System.nanoTime() - start;
            circuitBreaker.onSuccess(elapsed, TimeUnit.NANOSECONDS);

            BigDecimal cost = costOf(model, response);
            invocation.spent = invocation.spent.add(cost);
            analysis.setCostCents(cost);
            analysis.setLatencyMs(TimeUnit.NANOSECONDS.toMillis(elapsed));
            analysis.setModel(model);
            recordAttempt(invocation, model, attempt, response, cost, elapsed, null);
            log.info("AI analysis for email {} succeeded with {} in {} ms, {} cents",
                    emailRecordId, model, TimeUnit.NANOSECONDS.toMillis(elapsed), cost);
            return analysis;
        } catch (AiAnalysisClient.QuotaException e) {
            long elapsed = System.nanoTime() - start;
            circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, e);
            recordAttempt(invocation, model, attempt, null, BigDecimal.ZERO, elapsed, e);
            invocation.lastError = e.getMessage();
            throw e;
        } catch (InterruptedException e) {
            circuitBreaker.releasePermission();
            throw e;
        } catch (TimeoutException e) {
            long elapsed = System.nanoTime() - start;
            TimeoutException timeout = new TimeoutException(
                    "AI call timed out after " + properties.getCallTimeout().toMillis() + " ms");
            circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, timeout);
            // The provider may have billed the abandoned call in full
            BigDecimal cost = attemptCeiling(model, invocation.promptTokens);
            invocation.spent = invocation.spent.add(cost);
            recordAttempt(invocation, model, attempt, null, cost, elapsed, timeout);
            invocation.lastError = timeout.getMessage();
            log.warn("AI call attempt {} with {} timed out for email {}", attempt, model, emailRecordId);
            throw timeout;
        } catch (Exception e) {
            long elapsed = System.nanoTime() - start;
            circuitBreaker.onError(elapsed, TimeUnit.NANOSECONDS, e);
            // A reply that failed to parse was still paid for
            BigDecimal cost = response != null ? costOf(model, response) : BigDecimal.ZERO;
            invocation.spent = invocation.spent.add(cost);
            recordAttempt(invocation, model, attempt, response, cost, elapsed, e);
            invocation.lastError = e.getMessage();
            log.warn("AI call attempt {} with {} failed for email {}: {}", attempt, model, emailRecordId, e.getMessage());
            throw e;
        }
    }

    // A token covers at least one byte of text
    static long promptTokenBound(String prompt) {
        return (long) OpenAiAnalysisClient.SYSTEM_PROMPT.getBytes(StandardCharsets.UTF_8).length
                + prompt.getBytes(StandardCharsets.UTF_8).length
                + MESSAGE_OVERHEAD_TOKENS;
    }

    private BigDecimal attemptCeiling(String model, long promptTokens) {
        return modelPricing.costCents(model, promptTokens, properties.getMaxTokens());
    }

    private BigDecimal costOf(String model, AiAnalysisResponse response) {
        return modelPricing.costCents(model, response.getPromptTokens(), response.getCompletionTokens());
    }

    private void recordAttempt(Invocation invocation, String model, int attempt,
                               AiAnalysisResponse response, BigDecimal cost, long elapsedNanos, Exception error) {
        AiUsageLog entry = new AiUsageLog();
        entry.setUserId(invocation.userId);
        entry.setEmailRecordId(invocation.emailRecordId);
        entry.setModel(model);
        entry.setAttempt(attempt);
        entry.setPromptTokens(response != null ? response.getPromptTokens() : 0);
        entry.setCompletionTokens(response != null ? response.getCompletionTokens() : 0);
        entry.setCostCents(cost);
        entry.setChargedCents(ModelPricing.chargeableCents(cost));
        entry.setLatencyMs(TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        entry.setSuccess(error == null);
        if (error != null) {
            entry.setErrorType(error.getClass().getSimpleName());
            String message = error.getMessage();
            entry.setErrorMessage(message != null && message.length() > 1000 ? message.substring(0, 1000) : message);
        }
        entry.setCreatedAt(Instant.now(clock));
        try {
            usageLogRepository.save(entry);
        } catch (DataAccessException e) {
            log.warn("Could not record AI usage for email {}: {}", invocation.emailRecordId, e.getMessage());
        }
    }

    // Running totals of one invocation, touched only by the invoking thread
    private static class Invocation {
        final String userId;
        final String emailRecordId;
        final long promptTokens;
        int attempts;
        int modelAttempts;
        BigDecimal spent = BigDecimal.ZERO;
        String lastError;

        Invocation(String userId, String emailRecordId, long promptTokens) {
            this.userId = userId;
            this.emailRecordId = emailRecordId;
            this.promptTokens = promptTokens;
        }
    }
}
