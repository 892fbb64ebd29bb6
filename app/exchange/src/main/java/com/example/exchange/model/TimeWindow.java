package com.example.exchange.model;

import java.time.Duration;
import java.time.Instant;

/** 半開区間 {@code [start, end)}。 */
public record TimeWindow(Instant start, Instant end) {

  public boolean isValid() {
    return start != null && end != null && start.isBefore(end);
  }

  public boolean overlaps(TimeWindow other) {
    return latestStart(other).isBefore(earliestEnd(other));
  }

  /** 重なっている長さ。重ならなければ {@link Duration#ZERO}。 */
  public Duration overlapWith(TimeWindow other) {
    if (!overlaps(other)) {
      return Duration.ZERO;
    }
    return Duration.between(latestStart(other), earliestEnd(other));
  }

  private Instant latestStart(TimeWindow other) {
    return start.isAfter(other.start) ? start : other.start;
  }

  private Instant earliestEnd(TimeWindow other) {
    return end.isBefore(other.end) ? end : other.end;
  }
}
