package io.taskhive.taskqueue;

import io.taskhive.queue.event.QueueEvent;
import io.taskhive.queue.event.QueueEventListener;
import java.util.Objects;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Republishes queue lifecycle events as Spring application events so beans can observe them with
 * {@code @EventListener}.
 */
public class SpringQueueEventBridge implements QueueEventListener {

  private final ApplicationEventPublisher publisher;

  public SpringQueueEventBridge(ApplicationEventPublisher publisher) {
    this.publisher = Objects.requireNonNull(publisher, "publisher");
  }

  @Override
  public void onEvent(QueueEvent event) {
    publisher.publishEvent(event);
  }
}
