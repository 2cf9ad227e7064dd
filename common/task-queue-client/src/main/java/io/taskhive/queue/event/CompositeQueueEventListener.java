package io.taskhive.queue.event;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans events out to several listeners. A failing listener is logged and does not stop the others.
 */
public final class CompositeQueueEventListener implements QueueEventListener {

  private static final Logger log = LoggerFactory.getLogger(CompositeQueueEventListener.class);

  private final List<QueueEventListener> delegates;

  public CompositeQueueEventListener(List<? extends QueueEventListener> delegates) {
    Objects.requireNonNull(delegates, "delegates");
    this.delegates = List.copyOf(delegates);
  }

  @Override
  public void onEvent(QueueEvent event) {
    for (QueueEventListener delegate : delegates) {
      try {
        delegate.onEvent(event);
      } catch (RuntimeException ex) {
        log.warn("Listener {} failed to handle {}: {}", delegate.getClass().getSimpleName(), event.name(),
            ex.getMessage(), ex);
      }
    }
  }
}
