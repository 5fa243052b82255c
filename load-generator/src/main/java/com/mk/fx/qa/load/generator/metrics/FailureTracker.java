package com.mk.fx.qa.load.generator.metrics;

import com.mk.fx.qa.load.generator.rest.TransportResult;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Breaks failed attempts down by reason: the transport failure type, or {@code HTTP_<status>} for
 * responses outside the success range. Kept apart from {@link Counters}, which stays the source of
 * truth for totals.
 */
public class FailureTracker {

  private final Map<String, AtomicLong> breakdown = new ConcurrentHashMap<>();

  /** Records the reason of a failed attempt; successful results are ignored. */
  public void record(TransportResult result) {
    if (result == null) {
      recordReason("UNKNOWN");
      return;
    }
    if (result.isSuccess()) {
      return;
    }
    recordReason(
        result.hasResponse() ? "HTTP_" + result.statusCode() : result.failure().type().name());
  }

  /** Records a failure that did not come from the transport, e.g. an unexpected exception. */
  public void recordReason(String reason) {
    var key = reason == null || reason.isBlank() ? "UNKNOWN" : reason.toUpperCase(Locale.ROOT);
    breakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  /** Sorted, read-only copy of the breakdown. */
  public Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new TreeMap<>();
    for (var e : breakdown.entrySet()) {
      map.put(e.getKey(), e.getValue().get());
    }
    return Collections.unmodifiableMap(map);
  }

  public void reset() {
    breakdown.clear();
  }
}
