package com.acme.inventory.resilience;

import static org.assertj.core.api.Assertions.*;

import com.acme.inventory.core.CircuitOpenException;
import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.PermanentException;
import com.acme.inventory.core.TransientException;
import com.acme.inventory.support.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GuardedCallTest {

  private MutableClock clock;
  private CircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-06-01T00:00:00Z");
    breaker =
        new CircuitBreaker(
            "assume-role",
            CircuitBreakerSettings.of(2, Duration.ofSeconds(60)),
            ErrorClassifier.defaults(),
            clock);
  }

  @Test
  @DisplayName("returns the operation result and records success")
  void success() throws Exception {
    String result = GuardedCall.of(breaker, () -> "session").execute();

    assertThat(result).isEqualTo("session");
    assertThat(breaker.snapshot().lastSuccessTime()).isEqualTo(clock.instant());
  }

  @Test
  @DisplayName("rethrows the original error unchanged and records it")
  void failurePropagates() {
    TransientException error = new TransientException("Throttling", "slow down", null);

    assertThatThrownBy(() -> GuardedCall.of(breaker, () -> { throw error; }).execute()).isSameAs(error);
    assertThat(breaker.getFailureCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("checked exceptions pass through as well")
  void checkedFailurePropagates() {
    IOException error = new IOException("connection reset");

    assertThatThrownBy(() -> GuardedCall.<String>of(breaker, () -> { throw error; }).execute())
        .isSameAs(error);
    assertThat(breaker.getFailureCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("permanent failures propagate without counting")
  void permanentFailure() {
    assertThatThrownBy(
            () -> GuardedCall.of(breaker, () -> { throw new PermanentException("AccessDenied", "no", null); })
                .execute())
        .isInstanceOf(PermanentException.class);
    assertThat(breaker.getFailureCount()).isZero();
  }

  @Test
  @DisplayName("a trial call that throws an Error releases the HALF_OPEN slot")
  void errorInTrialReleasesSlot() throws Exception {
    breaker.recordFailure(new TransientException("a"));
    breaker.recordFailure(new TransientException("b"));
    clock.advance(Duration.ofSeconds(61));
    StackOverflowError error = new StackOverflowError();

    assertThatThrownBy(() -> GuardedCall.of(breaker, () -> { throw error; }).execute()).isSameAs(error);
    assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

    clock.advance(Duration.ofHours(1));
    assertThat(GuardedCall.of(breaker, () -> "recovered").execute()).isEqualTo("recovered");
    assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
  }

  @Test
  @DisplayName("open circuit fails fast without invoking the operation")
  void openCircuitFailsFast() {
    breaker.recordFailure(new TransientException("a"));
    breaker.recordFailure(new TransientException("b"));
    AtomicInteger calls = new AtomicInteger();

    assertThatThrownBy(() -> GuardedCall.of(breaker, calls::incrementAndGet).execute())
        .isInstanceOf(CircuitOpenException.class)
        .hasMessageContaining("assume-role");
    assertThat(calls).hasValue(0);
  }

  @Test
  @DisplayName("open circuit answers with the fallback when one is configured")
  void fallback() throws Exception {
    breaker.recordFailure(new TransientException("a"));
    breaker.recordFailure(new TransientException("b"));

    String result = GuardedCall.of(breaker, () -> "live").withFallback(() -> "cached").execute();

    assertThat(result).isEqualTo("cached");
  }

  @Test
  @DisplayName("the fallback is not used while the circuit is closed")
  void fallbackNotUsedWhenClosed() throws Exception {
    GuardedCall<String> call = GuardedCall.of(breaker, () -> "live").withFallback(() -> "cached");

    assertThat(call.execute()).isEqualTo("live");
    assertThat(call.name()).isEqualTo("assume-role");
  }

  @Test
  @DisplayName("registry shares one breaker per name")
  void registrySharesBreakers() {
    CircuitBreakerRegistry registry =
        new CircuitBreakerRegistry(
            name -> CircuitBreakerSettings.of(1, Duration.ofSeconds(5)), ErrorClassifier.defaults(), clock);

    CircuitBreaker first = registry.get("iam-detail");
    first.recordFailure(new TransientException("x"));

    assertThat(registry.get("iam-detail")).isSameAs(first);
    assertThat(registry.get("iam-list")).isNotSameAs(first);
    assertThat(registry.snapshots()).containsOnlyKeys("iam-detail", "iam-list");
    assertThat(registry.snapshots().get("iam-detail").state()).isEqualTo(CircuitState.OPEN);

    registry.resetAll();
    assertThat(first.getState()).isEqualTo(CircuitState.CLOSED);
  }
}
