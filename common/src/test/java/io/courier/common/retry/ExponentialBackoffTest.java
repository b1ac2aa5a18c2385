package io.courier.common.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/** Tests for ExponentialBackoff. */
class ExponentialBackoffTest {

  @Test
  void testIntervalsGrowByMultiplierWithoutRandomization() {
    ExponentialBackoff backoff =
        ExponentialBackoff.builder()
            .initialIntervalMillis(100)
            .multiplier(2.0)
            .randomizationFactor(0)
            .maxIntervalMillis(10_000)
            .random(() -> 0.0)
            .build();

    assertEquals(100, backoff.nextBackoffMillis());
    assertEquals(200, backoff.nextBackoffMillis());
    assertEquals(400, backoff.nextBackoffMillis());
    assertEquals(800, backoff.nextBackoffMillis());
  }

  @Test
  void testIntervalIsCappedAtMaxInterval() {
    ExponentialBackoff backoff =
        ExponentialBackoff.builder()
            .initialIntervalMillis(100)
            .multiplier(10.0)
            .randomizationFactor(0)
            .maxIntervalMillis(500)
            .random(() -> 0.0)
            .build();

    assertEquals(100, backoff.nextBackoffMillis());
    assertEquals(500, backoff.nextBackoffMillis());
    assertEquals(500, backoff.nextBackoffMillis());
    assertEquals(500, backoff.getCurrentIntervalMillis());
  }

  @Test
  void testRandomizedIntervalStaysWithinBounds() {
    ExponentialBackoff low =
        ExponentialBackoff.builder()
            .initialIntervalMillis(1000)
            .randomizationFactor(0.5)
            .random(() -> 0.0)
            .build();
    ExponentialBackoff high =
        ExponentialBackoff.builder()
            .initialIntervalMillis(1000)
            .randomizationFactor(0.5)
            .random(() -> 0.999999)
            .build();

    assertEquals(500, low.nextBackoffMillis());
    long upper = high.nextBackoffMillis();
    assertTrue(upper >= 1499 && upper <= 1501, "Unexpected upper bound " + upper);
  }

  @Test
  void testZeroMaxElapsedNeverStops() {
    AtomicLong now = new AtomicLong(0);
    ExponentialBackoff backoff =
        ExponentialBackoff.builder().maxElapsedMillis(0).clock(now::get).build();

    now.set(Long.MAX_VALUE / 2);
    assertNotEquals(ExponentialBackoff.STOP, backoff.nextBackoffMillis());
  }

  @Test
  void testStopsAfterMaxElapsed() {
    AtomicLong now = new AtomicLong(0);
    ExponentialBackoff backoff =
        ExponentialBackoff.builder().maxElapsedMillis(1000).clock(now::get).build();

    assertNotEquals(ExponentialBackoff.STOP, backoff.nextBackoffMillis());
    now.set(1001);
    assertEquals(ExponentialBackoff.STOP, backoff.nextBackoffMillis());

    backoff.reset();
    assertNotEquals(ExponentialBackoff.STOP, backoff.nextBackoffMillis());
  }

  @Test
  void testResetRestartsSequence() {
    ExponentialBackoff backoff =
        ExponentialBackoff.builder()
            .initialIntervalMillis(100)
            .multiplier(2.0)
            .randomizationFactor(0)
            .random(() -> 0.0)
            .build();

    backoff.nextBackoffMillis();
    backoff.nextBackoffMillis();
    backoff.reset();

    assertEquals(100, backoff.nextBackoffMillis());
  }

  @Test
  void testInvalidSettingsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ExponentialBackoff.builder().initialIntervalMillis(0));
    assertThrows(
        IllegalArgumentException.class, () -> ExponentialBackoff.builder().multiplier(0.5));
    assertThrows(
        IllegalArgumentException.class,
        () -> ExponentialBackoff.builder().randomizationFactor(1.0));
    ExponentialBackoff.Builder inverted =
        ExponentialBackoff.builder().initialIntervalMillis(2000).maxIntervalMillis(1000);
    assertThrows(IllegalArgumentException.class, inverted::build);
  }
}
