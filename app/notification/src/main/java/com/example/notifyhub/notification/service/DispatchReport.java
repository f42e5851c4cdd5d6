package com.example.notifyhub.notification.service;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record DispatchReport(int claimed, Map<DispatchOutcome, Integer> outcomes) {

  public static final DispatchReport EMPTY = new DispatchReport(0, Map.of());

  public DispatchReport {
    outcomes = Collections.unmodifiableMap(copy(outcomes));
  }

  public static DispatchReport of(Collection<DispatchOutcome> results) {
    final Map<DispatchOutcome, Integer> counts = new EnumMap<>(DispatchOutcome.class);
    for (DispatchOutcome outcome : results) {
      counts.merge(outcome, 1, Integer::sum);
    }
    return new DispatchReport(results.size(), counts);
  }

  public int count(DispatchOutcome outcome) {
    return outcomes.getOrDefault(outcome, 0);
  }

  private static Map<DispatchOutcome, Integer> copy(Map<DispatchOutcome, Integer> source) {
    final Map<DispatchOutcome, Integer> target = new EnumMap<>(DispatchOutcome.class);
    if (source != null) {
      target.putAll(source);
    }
    return target;
  }
}
