package io.taskhive.queue.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingQueueEventListener implements QueueEventListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingQueueEventListener.class);

  @Override
  public void onEvent(QueueEvent event) {
    if (event instanceof QueueEvent.HealthAlertRaised raised) {
      log.warn("{} [{}] {}: {}", event.name(), raised.alert().severity(), raised.alert().type(),
          raised.alert().message());
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("{} queue={} {}", event.name(), event.queueName(), event);
    }
  }
}
