package com.flamingo.ai.pdfchat.service.rag;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.ValidationException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs calls to external backends (embedding model, vector store, generation providers) with an
 * explicit timeout and a bounded retry policy.
 *
 * <p>Each attempt runs on the {@code backendCallExecutor} pool so a stuck call can be cancelled
 * without blocking the request thread forever. A timed-out attempt surfaces as {@link
 * java.util.concurrent.TimeoutException}, which callers treat like any other failure. {@link
 * ValidationException}s are never retried.
 */
@Component
@Slf4j
public class BackendCallExecutor {

  private final AsyncTaskExecutor executor;

  public BackendCallExecutor(@Qualifier("backendCallExecutor") AsyncTaskExecutor executor) {
    this.executor = executor;
  }

  /**
   * Executes a call once, bounded by a timeout.
   *
   * @param name backend name used for logging
   * @param timeout maximum duration of the attempt
   * @param call the backend call
   * @return the call result
   * @throws Exception the call's own exception, or {@link java.util.concurrent.TimeoutException}
   */
  public <T> T call(String name, Duration timeout, Callable<T> call) throws Exception {
    return call(name, timeout, new RagConfig.Retry(1, Duration.ZERO, false), call);
  }

  /**
   * Executes a call with a timeout per attempt and a bounded number of attempts.
   *
   * @param name backend name used for logging and for the resilience4j instances
   * @param timeout maximum duration of a single attempt
   * @param retryPolicy attempt count and backoff
   * @param call the backend call
   * @return the result of the first successful attempt
   * @throws Exception the last attempt's failure once attempts are exhausted
   */
  public <T> T call(String name, Duration timeout, RagConfig.Retry retryPolicy, Callable<T> call)
      throws Exception {
    TimeLimiter timeLimiter =
        TimeLimiter.of(
            name,
            TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
    Retry retry = Retry.of(name, retryConfig(retryPolicy));
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying {} (attempt {}): {}",
                    name,
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown"));

    Callable<T> limited = () -> timeLimiter.executeFutureSupplier(() -> executor.submit(call));
    try {
      return Retry.decorateCallable(retry, limited).call();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    }
  }

  private static RetryConfig retryConfig(RagConfig.Retry policy) {
    RetryConfig.Builder<Object> builder =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, policy.getMaxAttempts()))
            .ignoreExceptions(ValidationException.class, InterruptedException.class);
    Duration wait = policy.getWaitDuration();
    if (wait == null || wait.isZero() || wait.isNegative()) {
      wait = Duration.ofMillis(1);
    }
    if (policy.isExponentialBackoff()) {
      builder.intervalFunction(IntervalFunction.ofExponentialBackoff(wait, 2.0));
    } else {
      builder.waitDuration(wait);
    }
    return builder.build();
  }
}
