package com.flamingo.ai.discovery.service.generation;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.exception.GenerationFailureException;
import com.flamingo.ai.discovery.exception.LlmServiceException;
import com.flamingo.ai.discovery.provider.LlmProvider;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Calls the {@link LlmProvider} with a per-attempt timeout and a bounded retry policy.
 *
 * <p>Only transient failures are retried, with exponential backoff: timeouts, provider errors
 * flagged transient (rate limits, 5xx) and blank answers. Anything else fails on the first attempt.
 * Streaming answers are collected into one text, so both modes look the same to callers.
 *
 * <p>Interrupting the calling thread cancels the in-flight call and raises {@link
 * CancellationException}.
 */
@Component
@Slf4j
public class ResilientLlmCaller {

  private final LlmProvider llmProvider;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Retry retry;

  public ResilientLlmCaller(
      LlmProvider llmProvider, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.llmProvider = llmProvider;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    RagConfig.Generation generation = ragConfig.getGeneration();
    this.retry =
        Retry.of(
            "llm-generation",
            RetryConfig.custom()
                .maxAttempts(Math.max(1, generation.getMaxAttempts()))
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(
                        generation.getInitialBackoff(), generation.getBackoffMultiplier()))
                .retryOnException(ResilientLlmCaller::isTransient)
                .build());
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "LLM attempt {} failed, retrying in {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    event.getLastThrowable() == null
                        ? "unknown"
                        : event.getLastThrowable().getMessage()));
  }

  /**
   * Generates an answer for the prompt.
   *
   * @param prompt assembled prompt; its completion share bounds the answer length
   * @param temperature sampling temperature
   * @return the non-blank answer text
   * @throws GenerationFailureException when retries are exhausted or the failure is not transient
   * @throws CancellationException when the calling thread is interrupted
   */
  public String call(Prompt prompt, double temperature) {
    AtomicInteger attempts = new AtomicInteger();
    try {
      return Retry.decorateSupplier(
              retry,
              () -> {
                attempts.incrementAndGet();
                return attempt(prompt, temperature);
              })
          .get();
    } catch (LlmServiceException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw cancelled(e);
      }
      meterRegistry
          .counter("generation.llm.failures", "transient", String.valueOf(e.isTransient()))
          .increment();
      String reason =
          e.isTransient()
              ? "LLM call failed after " + attempts.get() + " attempts: " + e.getMessage()
              : "LLM call failed: " + e.getMessage();
      throw new GenerationFailureException(reason, attempts.get(), e);
    }
  }

  private String attempt(Prompt prompt, double temperature) {
    RagConfig.Generation generation = ragConfig.getGeneration();
    int maxTokens = prompt.completionTokens();
    Mono<String> call =
        generation.isStreaming()
            ? llmProvider.stream(prompt, temperature, maxTokens).collect(Collectors.joining())
            : Mono.fromCallable(() -> llmProvider.complete(prompt, temperature, maxTokens))
                .subscribeOn(Schedulers.boundedElastic());

    CompletableFuture<String> future = call.timeout(generation.getTimeout()).toFuture();
    String text;
    try {
      text = future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw cancelled(e);
    } catch (ExecutionException e) {
      throw translate(e.getCause());
    }

    if (text == null || text.isBlank()) {
      throw new LlmServiceException("LLM returned an empty answer", true);
    }
    if (text.length() > generation.getMaxContentLength()) {
      throw new LlmServiceException(
          "LLM answer of "
              + text.length()
              + " characters exceeds the limit of "
              + generation.getMaxContentLength(),
          false);
    }
    meterRegistry.counter("generation.llm.success").increment();
    return text;
  }

  private static LlmServiceException translate(Throwable cause) {
    if (cause instanceof LlmServiceException llmException) {
      return llmException;
    }
    if (cause instanceof TimeoutException) {
      return new LlmServiceException("LLM call timed out", true, cause);
    }
    return new LlmServiceException(
        "Unexpected LLM error: " + (cause == null ? "unknown" : cause.getMessage()), false, cause);
  }

  private static boolean isTransient(Throwable throwable) {
    return throwable instanceof LlmServiceException llmException
        && llmException.isTransient()
        && !Thread.currentThread().isInterrupted();
  }

  private static CancellationException cancelled(Throwable cause) {
    CancellationException cancellation = new CancellationException("LLM call cancelled");
    cancellation.initCause(cause);
    return cancellation;
  }
}
