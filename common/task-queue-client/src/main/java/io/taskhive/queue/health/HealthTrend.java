package io.taskhive.queue.health;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum HealthTrend {
  IMPROVING,
  DEGRADING,
  STABLE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
