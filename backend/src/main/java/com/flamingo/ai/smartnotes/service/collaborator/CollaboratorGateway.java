package com.flamingo.ai.smartnotes.service.collaborator;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.enums.CollaboratorType;
import com.flamingo.ai.smartnotes.exception.CollaboratorException;
import com.flamingo.ai.smartnotes.exception.CollaboratorTimeoutException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Single entry point for calls to external collaborators.
 *
 * <p>Each call runs on the collaborator executor under a Resilience4j {@link TimeLimiter}, so a
 * hung model call cannot hold a document lock indefinitely, and is retried with exponential
 * backoff by a Resilience4j {@link Retry} when the failure is retriable. Raw exceptions never leave
 * this class: they are translated to {@link CollaboratorException}.
 */
@Component
@Slf4j
public class CollaboratorGateway {

  private static final Pattern RETRIABLE_MESSAGE =
      Pattern.compile(
          ".*(rate.?limit|too many requests|\\b429\\b|timed? ?out|timeout|temporarily|"
              + "unavailable|overloaded|\\b50[0234]\\b|connection reset).*",
          Pattern.DOTALL);

  private final ExecutorService executor;
  private final MeterRegistry meterRegistry;
  private final Duration timeout;
  private final TimeLimiter timeLimiter;
  private final RetryConfig retryConfig;

  @Autowired
  public CollaboratorGateway(
      SmartNotesConfig config,
      @Qualifier("collaboratorExecutor") ThreadPoolTaskExecutor collaboratorExecutor,
      MeterRegistry meterRegistry) {
    this(config, collaboratorExecutor.getThreadPoolExecutor(), meterRegistry);
  }

  public CollaboratorGateway(
      SmartNotesConfig config, ExecutorService executor, MeterRegistry meterRegistry) {
    SmartNotesConfig.Collaborator settings = config.getCollaborator();
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.timeout = Duration.ofSeconds(settings.getTimeoutSeconds());
    this.timeLimiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.getMaxAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    Math.max(1, settings.getBackoffInitialMs()), 2.0))
            .retryOnException(
                ex -> ex instanceof CollaboratorException ce && ce.isRetriable())
            .build();
  }

  /**
   * Invokes a collaborator under the time limit and retry policy.
   *
   * @param collaborator the capability being called
   * @param operation short operation name for logs and errors
   * @param call the call itself
   * @return the call's result
   * @throws CollaboratorException when the call fails after the retry policy is exhausted
   */
  public <T> T call(CollaboratorType collaborator, String operation, Callable<T> call) {
    Retry retry = Retry.of(collaborator.name().toLowerCase(Locale.ROOT) + "-" + operation,
        retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying {} {} (attempt {}): {}",
                    collaborator,
                    operation,
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() == null
                        ? "unknown"
                        : event.getLastThrowable().getMessage()));

    Callable<T> limited =
        () -> {
          try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(call));
          } catch (Exception e) {
            throw translate(collaborator, operation, e);
          }
        };

    try {
      return Retry.decorateCallable(retry, limited).call();
    } catch (CollaboratorException e) {
      meterRegistry
          .counter(
              "collaborator.failures",
              "collaborator",
              collaborator.name(),
              "retriable",
              String.valueOf(e.isRetriable()))
          .increment();
      log.error("{} {} failed: {}", collaborator, operation, e.getMessage());
      throw e;
    } catch (Exception e) {
      throw translate(collaborator, operation, e);
    }
  }

  CollaboratorException translate(CollaboratorType collaborator, String operation, Exception e) {
    if (e instanceof CollaboratorException ce) {
      return ce;
    }
    if (e instanceof TimeoutException) {
      return new CollaboratorTimeoutException(collaborator, operation, timeout, e);
    }
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      return new CollaboratorException(collaborator, operation, "interrupted", false, e);
    }
    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    return new CollaboratorException(collaborator, operation, message, isRetriable(e), e);
  }

  /** Transport failures, timeouts, rate limits and 5xx responses are worth another attempt. */
  static boolean isRetriable(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 10) {
      if (current instanceof IOException || current instanceof TimeoutException) {
        return true;
      }
      String message = current.getMessage();
      if (message != null
          && RETRIABLE_MESSAGE.matcher(message.toLowerCase(Locale.ROOT)).matches()) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
