package io.taskhive.queue.event;

/**
 * Observer of queue lifecycle events. Implementations are invoked on the thread that produced the event and
 * must not block.
 */
@FunctionalInterface
public interface QueueEventListener {

  void onEvent(QueueEvent event);

  static QueueEventListener noop() {
    return event -> { };
  }
}
