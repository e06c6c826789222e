package com.proteincollector.common.retry;

import com.proteincollector.common.Sleeper;
import com.proteincollector.common.error.ErrorContext;
import com.proteincollector.common.error.ErrorHandler;
import com.proteincollector.common.error.ErrorInfo;
import com.proteincollector.common.error.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bounded retry loop with exponential backoff around an opaque operation.
 *
 * <p>Each failure is classified by {@link ErrorHandler}. The operation is retried only while attempts remain and the
 * recommended action is RETRY or FALLBACK; any other action propagates the original exception at once. After the last
 * attempt the original exception is rethrown unchanged.
 *
 * <p>{@link #execute} blocks the calling thread between attempts; {@link #executeAsync} suspends with
 * {@code Mono.delay} instead. Both use the same decision logic. Cancellation (thread interrupt, or disposal of the
 * reactive subscription) is never retried.
 */
@Slf4j
public class RetryController {

    private final RetryPolicy defaultPolicy;
    private final ErrorHandler errorHandler;
    private final Sleeper sleeper;
    private final Scheduler scheduler;

    public RetryController(RetryPolicy defaultPolicy) {
        this(defaultPolicy, new ErrorHandler(), Sleeper.threadSleep(), Schedulers.parallel());
    }

    public RetryController(RetryPolicy defaultPolicy, ErrorHandler errorHandler, Sleeper sleeper, Scheduler scheduler) {
        this.defaultPolicy = defaultPolicy != null ? defaultPolicy : RetryPolicy.defaultPolicy();
        this.errorHandler = errorHandler != null ? errorHandler : new ErrorHandler();
        this.sleeper = sleeper != null ? sleeper : Sleeper.threadSleep();
        this.scheduler = scheduler != null ? scheduler : Schedulers.parallel();
    }

    public <T> T execute(Supplier<T> operation, String database, String operationName) {
        return execute(operation, database, operationName, defaultPolicy);
    }

    /**
     * Run the operation, blocking between attempts.
     *
     * @param policy per-call override of the controller's default policy
     * @return the first successful result
     */
    public <T> T execute(Supplier<T> operation, String database, String operationName, RetryPolicy policy) {
        RetryPolicy effective = policy != null ? policy : defaultPolicy;
        for (int attempt = 0; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (e instanceof OperationCancelledException || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                Optional<Duration> delay = nextDelay(e, attempt, effective, database, operationName);
                if (delay.isEmpty()) {
                    throw e;
                }
                pause(delay.get(), database, operationName);
            }
        }
    }

    public <T> Mono<T> executeAsync(Supplier<? extends Mono<T>> operation, String database, String operationName) {
        return executeAsync(operation, database, operationName, defaultPolicy);
    }

    /**
     * Reactive variant: the operation is subscribed once per attempt and backoff is a {@code Mono.delay} on the
     * controller's scheduler.
     */
    public <T> Mono<T> executeAsync(Supplier<? extends Mono<T>> operation, String database, String operationName,
                                    RetryPolicy policy) {
        RetryPolicy effective = policy != null ? policy : defaultPolicy;
        return attemptAsync(operation, database, operationName, effective, 0);
    }

    private <T> Mono<T> attemptAsync(Supplier<? extends Mono<T>> operation, String database, String operationName,
                                     RetryPolicy policy, int attempt) {
        return Mono.<T>defer(operation).onErrorResume(e -> {
            Optional<Duration> delay = nextDelay(e, attempt, policy, database, operationName);
            if (delay.isEmpty()) {
                return Mono.error(e);
            }
            return Mono.delay(delay.get(), scheduler)
                    .then(attemptAsync(operation, database, operationName, policy, attempt + 1));
        });
    }

    /**
     * Decide what follows the failed zero-based attempt: a backoff delay, or empty when the failure must propagate.
     */
    Optional<Duration> nextDelay(Throwable error, int attempt, RetryPolicy policy, String database, String operationName) {
        ErrorContext context = ErrorContext.of(operationName, database)
                .withAdditionalData(Map.of("attempt", attempt + 1, "maxRetries", policy.getMaxRetries()));
        ErrorInfo info = errorHandler.classify(error, context);
        if (attempt >= policy.getMaxRetries()) {
            log.error("Final failure for {} on {} at attempt {} after {} retries: {} category={} action={} type={}",
                    operationName, database, attempt + 1, policy.getMaxRetries(), info.message(), info.category(),
                    info.action(), error.getClass().getSimpleName());
            return Optional.empty();
        }
        if (!info.action().isRetryable()) {
            log.info("Non-retryable error for {} on {} at attempt {}: category={} action={}",
                    operationName, database, attempt + 1, info.category(), info.action());
            return Optional.empty();
        }
        Duration delay = policy.delayFor(attempt);
        logRetryAttempt(new RetryAttempt(attempt + 1, delay, info, database, operationName), policy);
        return Optional.of(delay);
    }

    private void logRetryAttempt(RetryAttempt attempt, RetryPolicy policy) {
        log.warn("Retry attempt {} of {} for {} on {} in {}ms category={} action={} error={}",
                attempt.attemptNumber(), policy.getMaxRetries(), attempt.operation(), attempt.database(),
                attempt.delay().toMillis(), attempt.error().category(), attempt.error().action(), attempt.error().message());
    }

    private void pause(Duration delay, String database, String operationName) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting to retry " + operationName + " on " + database, e);
        }
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
}
