package io.intellixity.sqlbridge.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class RetryPolicyTest {

  @Test
  void ceilingDoublesUpToTheMaximum() {
    RetryPolicy p = RetryPolicy.of(10, Duration.ofMillis(10), Duration.ofMillis(70));

    assertEquals(10, p.backoffCeilingMillis(1));
    assertEquals(20, p.backoffCeilingMillis(2));
    assertEquals(40, p.backoffCeilingMillis(3));
    assertEquals(70, p.backoffCeilingMillis(4));
    assertEquals(70, p.backoffCeilingMillis(1_000));
  }

  @Test
  void zeroBaseMeansNoDelay() {
    assertEquals(0, RetryPolicy.NONE.backoffCeilingMillis(1));
    assertEquals(0, RetryPolicy.of(3, Duration.ZERO, Duration.ofSeconds(1)).backoffCeilingMillis(2));
  }

  @Test
  void validatesBounds() {
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(0, Duration.ZERO, Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(1, Duration.ofMillis(-1), Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(1, Duration.ofSeconds(2), Duration.ofSeconds(1)));
  }

  @Test
  void defaultsRetryTwice() {
    RetryPolicy d = RetryPolicy.defaults();
    assertEquals(3, d.maxAttempts());
    assertEquals(1, RetryPolicy.NONE.maxAttempts());
  }
}
