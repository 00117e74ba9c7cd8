package org.ratewatch.currency.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import org.ratewatch.currency.exception.CacheException;

class BestEffortTest {

  @Test
  void shouldReportSuccess() {
    var ran = new AtomicBoolean();

    var outcome = BestEffort.attempt("set-last-rates", () -> ran.set(true));

    assertThat(ran).isTrue();
    assertThat(outcome.succeeded()).isTrue();
    assertThat(outcome.operation()).isEqualTo("set-last-rates");
    assertThat(outcome.failure()).isNull();
  }

  @Test
  void shouldAbsorbDependencyFailure() {
    var failure = new CacheException("Redis down");

    var outcome =
        BestEffort.attempt(
            "set-last-rates",
            () -> {
              throw failure;
            });

    assertThat(outcome.succeeded()).isFalse();
    assertThat(outcome.failure()).isSameAs(failure);
  }

  @Test
  void shouldPropagateOtherFailures() {
    assertThatThrownBy(
            () ->
                BestEffort.attempt(
                    "set-last-rates",
                    () -> {
                      throw new IllegalStateException("bug");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("bug");
  }
}
