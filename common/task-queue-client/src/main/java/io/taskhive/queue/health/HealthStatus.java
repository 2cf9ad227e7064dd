package io.taskhive.queue.health;

import java.util.List;
import java.util.Objects;

/**
 * Condensed verdict: healthy iff connected and every queue scores at least {@link HealthScorer#HEALTHY_SCORE}.
 */
public record HealthStatus(boolean healthy, List<String> issues) {

  public HealthStatus {
    issues = List.copyOf(Objects.requireNonNull(issues, "issues"));
  }
}
