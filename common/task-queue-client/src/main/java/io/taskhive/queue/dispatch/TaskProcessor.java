package io.taskhive.queue.dispatch;

import io.taskhive.task.model.TaskMessage;

/**
 * Caller-supplied processing callback. Returning normally acks the delivery; throwing triggers the retry or
 * dead-letter path.
 */
@FunctionalInterface
public interface TaskProcessor {

  /**
   * @return an optional result, carried in the completion event
   */
  Object process(TaskMessage message) throws Exception;
}
