package io.taskhive.queue.health;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling record of raised alerts used to suppress repeats of the same issue within a cooldown window.
 */
public final class AlertHistory {

  public static final Duration DEFAULT_COOLDOWN = Duration.ofHours(1);

  private final Duration cooldown;
  private final Map<String, Instant> lastRaised = new LinkedHashMap<>();

  public AlertHistory() {
    this(DEFAULT_COOLDOWN);
  }

  public AlertHistory(Duration cooldown) {
    this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    if (cooldown.isNegative()) {
      throw new IllegalArgumentException("cooldown must not be negative");
    }
  }

  /**
   * Records the alert unless an alert with the same key was raised within the cooldown.
   * Expired entries are purged first.
   *
   * @return {@code true} if the alert should be emitted
   */
  public synchronized boolean tryRecord(HealthAlert alert, Instant now) {
    Objects.requireNonNull(alert, "alert");
    Objects.requireNonNull(now, "now");
    purgeExpired(now);
    String key = alert.deduplicationKey();
    if (lastRaised.containsKey(key)) {
      return false;
    }
    lastRaised.put(key, now);
    return true;
  }

  private void purgeExpired(Instant now) {
    Iterator<Map.Entry<String, Instant>> it = lastRaised.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Instant> entry = it.next();
      if (Duration.between(entry.getValue(), now).compareTo(cooldown) >= 0) {
        it.remove();
      }
    }
  }

  public synchronized int size() {
    return lastRaised.size();
  }

  /**
   * Most recently recorded alerts, oldest first.
   */
  public synchronized List<Entry> recent(int limit) {
    List<Entry> all = new ArrayList<>(lastRaised.size());
    lastRaised.forEach((key, raisedAt) -> all.add(new Entry(key, raisedAt)));
    int from = Math.max(0, all.size() - Math.max(0, limit));
    return List.copyOf(all.subList(from, all.size()));
  }

  public record Entry(String key, Instant raisedAt) {
  }
}
