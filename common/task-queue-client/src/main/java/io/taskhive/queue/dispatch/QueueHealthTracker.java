package io.taskhive.queue.dispatch;

import io.taskhive.queue.connection.QueueInfo;
import io.taskhive.task.model.QueueHealthStats;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-queue rolling processing statistics.
 * <p>
 * Entries are created on the first processed message of a queue and live for the process lifetime. The
 * average processing time and the error rate are cumulative over every processed message; they never decay.
 */
public final class QueueHealthTracker {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();

  /**
   * Records one processed delivery.
   */
  public void record(String queueName, long elapsedMillis, boolean success, Instant now) {
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(now, "now");
    Entry entry = entries.computeIfAbsent(queueName, name -> new Entry(name, now));
    entry.record(Math.max(0L, elapsedMillis), success, now);
  }

  /**
   * Overwrites depth and consumer count with broker-reported values and recomputes throughput from the
   * messages completed since the previous refresh. Queues without statistics are skipped.
   *
   * @return {@code false} if the queue has no statistics yet
   */
  public boolean refresh(String queueName, QueueInfo info, Instant now) {
    Objects.requireNonNull(info, "info");
    Objects.requireNonNull(now, "now");
    Entry entry = entries.get(queueName);
    if (entry == null) {
      return false;
    }
    entry.refresh(info, now);
    return true;
  }

  public boolean isTracked(String queueName) {
    return entries.containsKey(queueName);
  }

  public Optional<QueueHealthStats> snapshot(String queueName) {
    Entry entry = entries.get(queueName);
    return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
  }

  public List<QueueHealthStats> snapshots() {
    List<QueueHealthStats> result = new ArrayList<>(entries.size());
    for (Entry entry : entries.values()) {
      result.add(entry.snapshot());
    }
    result.sort((a, b) -> a.queueName().compareTo(b.queueName()));
    return result;
  }

  private static final class Entry {
    private final String queueName;
    private long messageCount;
    private int consumerCount = 1;
    private long processed;
    private long errors;
    private long completed;
    private double avgWaitTime;
    private double throughputPerSecond;
    private Instant lastProcessedAt;
    private Instant lastRefreshAt;
    private long completedAtLastRefresh;

    Entry(String queueName, Instant createdAt) {
      this.queueName = queueName;
      this.lastProcessedAt = createdAt;
      this.lastRefreshAt = createdAt;
    }

    synchronized void record(long elapsedMillis, boolean success, Instant now) {
      messageCount++;
      processed++;
      avgWaitTime = (avgWaitTime * (processed - 1) + elapsedMillis) / processed;
      if (success) {
        completed++;
      } else {
        errors++;
      }
      lastProcessedAt = now;
    }

    synchronized void refresh(QueueInfo info, Instant now) {
      messageCount = info.messageCount();
      consumerCount = info.consumerCount();
      long elapsed = Duration.between(lastRefreshAt, now).toMillis();
      if (elapsed > 0) {
        throughputPerSecond = (completed - completedAtLastRefresh) * 1000.0 / elapsed;
      }
      completedAtLastRefresh = completed;
      lastRefreshAt = now;
    }

    synchronized QueueHealthStats snapshot() {
      double errorRate = processed == 0 ? 0.0 : (double) errors / processed;
      return new QueueHealthStats(queueName, messageCount, consumerCount, avgWaitTime, throughputPerSecond,
          errorRate, lastProcessedAt);
    }
  }
}
