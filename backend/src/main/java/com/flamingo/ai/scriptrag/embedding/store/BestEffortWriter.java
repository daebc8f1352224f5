package com.flamingo.ai.scriptrag.embedding.store;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a storage operation whose failure must not reach the caller. Failures are logged, counted
 * and discarded.
 */
@Slf4j
public class BestEffortWriter {

  private final MeterRegistry meterRegistry;
  private final String metricName;

  public BestEffortWriter(MeterRegistry meterRegistry, String metricName) {
    this.meterRegistry = meterRegistry;
    this.metricName = metricName;
  }

  /**
   * Runs {@code action}, swallowing any runtime failure.
   *
   * @param description short label used in the log line
   * @return true if the action completed
   */
  public boolean run(String description, Runnable action) {
    return call(
            description,
            () -> {
              action.run();
              return Boolean.TRUE;
            })
        .isPresent();
  }

  /**
   * Runs {@code action} and returns its result, or empty if it failed.
   *
   * @param description short label used in the log line
   */
  public <T> Optional<T> call(String description, Supplier<T> action) {
    try {
      return Optional.ofNullable(action.get());
    } catch (RuntimeException e) {
      log.warn("Best-effort {} failed: {}", description, e.getMessage());
      meterRegistry.counter(metricName, "operation", description).increment();
      return Optional.empty();
    }
  }
}
