package io.taskhive.queue.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import io.taskhive.queue.codec.MessageHeaders;
import io.taskhive.queue.codec.TaskMessageCodec;
import io.taskhive.queue.connection.ChannelIds;
import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.connection.QueueInfo;
import io.taskhive.queue.connection.TaskPublishException;
import io.taskhive.queue.connection.TaskQueueTopology;
import io.taskhive.queue.event.QueueEvent;
import io.taskhive.task.model.MessageMetadata;
import io.taskhive.task.model.QueueHealthStats;
import io.taskhive.task.model.TaskMessage;
import io.taskhive.task.model.TaskPriority;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;

class TaskDispatcherTest {

  private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
  private static final String QUEUE = "tasks.normal";

  private final TaskMessageCodec codec = new TaskMessageCodec();
  private final List<QueueEvent> events = new CopyOnWriteArrayList<>();
  private final MutableClock clock = new MutableClock(START);

  private ConnectionManager connectionManager;
  private Channel delayedChannel;
  private Channel consumerChannel;
  private TaskDispatcher dispatcher;

  @BeforeEach
  void setUp() throws Exception {
    connectionManager = mock(ConnectionManager.class);
    delayedChannel = mock(Channel.class);
    consumerChannel = mock(Channel.class);
    when(consumerChannel.isOpen()).thenReturn(true);
    when(connectionManager.getChannel(ChannelIds.DELAYED_PUBLISHER)).thenReturn(delayedChannel);
    when(connectionManager.awaitPublisherConfirm(delayedChannel)).thenReturn(true);
    when(connectionManager.getChannel(ChannelIds.consumer(QUEUE))).thenReturn(consumerChannel);
    when(connectionManager.publishMessage(anyString(), any(TaskMessage.class), any(TaskPriority.class)))
        .thenReturn(true);
    when(consumerChannel.basicConsume(eq(QUEUE), eq(false), any(DeliverCallback.class), any(CancelCallback.class)))
        .thenReturn("ctag-1");
    dispatcher = new TaskDispatcher(connectionManager, codec, events::add, PermanentErrorClassifier.defaults(),
        new RetryBackoff(() -> 0.0), clock, mock(ScheduledExecutorService.class), Duration.ofSeconds(30));
  }

  @ParameterizedTest
  @EnumSource(TaskPriority.class)
  void enqueuePublishesDirectlyOnThePriorityRoutingKey(TaskPriority priority) {
    String id = dispatcher.enqueueTask("index", Map.of("doc", 1), EnqueueOptions.withPriority(priority));

    ArgumentCaptor<TaskMessage> message = ArgumentCaptor.forClass(TaskMessage.class);
    String routingKey = "task." + priority.wireName() + ".index";
    verify(connectionManager).publishMessage(eq(routingKey), message.capture(), eq(priority));
    assertThat(message.getValue().id()).isEqualTo(id);
    assertThat(message.getValue().metadata().correlationId()).isNotBlank().isNotEqualTo(id);
    assertThat(message.getValue().metadata().originalRoutingKey()).isEqualTo(routingKey);
    assertThat(message.getValue().payload().path("doc").asInt()).isEqualTo(1);
    assertThat(events).singleElement().isInstanceOf(QueueEvent.TaskEnqueued.class);
    assertThat(dispatcher.getMessageCounters()).containsEntry("enqueued." + priority.wireName(), 1L);
  }

  @Test
  void delayedEnqueueGoesThroughTheDelayedPublisher() throws Exception {
    dispatcher.enqueueTask("report", "payload", EnqueueOptions.withPriority(TaskPriority.HIGH)
        .delay(Duration.ofMillis(1500))
        .correlationId("corr-9"));

    verify(connectionManager, never()).publishMessage(anyString(), any(TaskMessage.class), any(TaskPriority.class));
    ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(delayedChannel).basicPublish(eq(TaskQueueTopology.DELAYED_EXCHANGE), eq("task.high.report"),
        props.capture(), any(byte[].class));
    assertThat(props.getValue().getHeaders())
        .containsEntry(MessageHeaders.DELAY, 1500L)
        .containsEntry(MessageHeaders.ORIGINAL_ROUTING_KEY, "task.high.report");
    assertThat(props.getValue().getCorrelationId()).isEqualTo("corr-9");
    QueueEvent.TaskEnqueued enqueued = (QueueEvent.TaskEnqueued) events.get(0);
    assertThat(enqueued.delay()).isEqualTo(Duration.ofMillis(1500));
  }

  @Test
  void successfulProcessingAcksAndRecordsStats() throws Exception {
    DeliverCallback callback = startConsumer(message -> {
      clock.advance(Duration.ofMillis(120));
      return "done";
    }, ConsumerOptions.defaults());

    callback.handle("ctag-1", delivery(7, message(0)));

    verify(consumerChannel).basicQos(1);
    verify(consumerChannel).basicAck(7, false);
    assertThat(events).extracting(QueueEvent::name)
        .containsExactly(QueueEvent.TASK_PROCESSING_STARTED, QueueEvent.TASK_PROCESSING_COMPLETED);
    QueueEvent.TaskProcessingCompleted completed = (QueueEvent.TaskProcessingCompleted) events.get(1);
    assertThat(completed.result()).isEqualTo("done");
    assertThat(completed.elapsedMillis()).isEqualTo(120);
    QueueHealthStats stats = dispatcher.getQueueHealth(QUEUE).get(0);
    assertThat(stats.avgWaitTime()).isEqualTo(120.0);
    assertThat(stats.errorRate()).isZero();
    assertThat(dispatcher.getMessageCounters())
        .containsEntry("processing." + QUEUE, 1L)
        .containsEntry("completed." + QUEUE, 1L);
  }

  @Test
  void malformedMessagesAreDiscardedWithoutProcessing() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    DeliverCallback callback = startConsumer(message -> calls.incrementAndGet(), ConsumerOptions.defaults());

    callback.handle("ctag-1", new Delivery(new Envelope(3, false, "processing", "task.normal.x"),
        new AMQP.BasicProperties(), "{broken".getBytes(StandardCharsets.UTF_8)));

    assertThat(calls).hasValue(0);
    verify(consumerChannel).basicNack(3, false, false);
    verify(delayedChannel, never()).basicPublish(anyString(), anyString(), any(), any(byte[].class));
    assertThat(events).isEmpty();
  }

  @Test
  void retryableFailureSchedulesDelayedRetryAndAcksOriginal() throws Exception {
    DeliverCallback callback = startConsumer(message -> {
      throw new IOException("downstream timeout");
    }, ConsumerOptions.defaults().retryDelay(Duration.ofSeconds(2)));

    callback.handle("ctag-1", delivery(11, message(1)));

    ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(delayedChannel).basicPublish(eq(TaskQueueTopology.DELAYED_EXCHANGE), eq("task.normal.index"),
        props.capture(), body.capture());
    assertThat(props.getValue().getHeaders())
        .containsEntry(MessageHeaders.DELAY, 4000L)
        .containsEntry(MessageHeaders.RETRY_COUNT, 2);
    TaskMessage retried = codec.decode(body.getValue());
    assertThat(retried.id()).isEqualTo("m-1");
    assertThat(retried.retryCount()).isEqualTo(2);
    verify(consumerChannel).basicAck(11, false);
    verify(consumerChannel, never()).basicNack(11L, false, false);

    QueueEvent.TaskRetryScheduled retry = (QueueEvent.TaskRetryScheduled) events.get(1);
    assertThat(retry.delayMillis()).isEqualTo(4000L);
    assertThat(retry.retryCount()).isEqualTo(2);
    assertThat(retry.error()).isEqualTo("downstream timeout");
    assertThat(dispatcher.getQueueHealth(QUEUE).get(0).errorRate()).isEqualTo(1.0);
  }

  @Test
  void permanentErrorsAreDeadLetteredOnFirstFailure() throws Exception {
    DeliverCallback callback = startConsumer(message -> {
      throw new IllegalArgumentException("ValidationError: title is required");
    }, ConsumerOptions.defaults().maxRetries(5));

    callback.handle("ctag-1", delivery(4, message(0)));

    verify(consumerChannel).basicNack(4, false, false);
    verify(delayedChannel, never()).basicPublish(anyString(), anyString(), any(), any(byte[].class));
    assertThat(events).filteredOn(e -> e instanceof QueueEvent.TaskDeadLettered).hasSize(1);
  }

  @Test
  void exhaustedRetriesAreDeadLetteredExactlyOnce() throws Exception {
    DeliverCallback callback = startConsumer(message -> {
      throw new IllegalStateException("still failing");
    }, ConsumerOptions.defaults().maxRetries(3));

    callback.handle("ctag-1", delivery(9, message(3)));

    verify(consumerChannel).basicNack(9, false, false);
    verify(consumerChannel, never()).basicAck(anyLong(), anyBoolean());
    List<QueueEvent> deadLetters = events.stream().filter(e -> e instanceof QueueEvent.TaskDeadLettered).toList();
    assertThat(deadLetters).hasSize(1);
    QueueEvent.TaskDeadLettered deadLetter = (QueueEvent.TaskDeadLettered) deadLetters.get(0);
    assertThat(deadLetter.deadLetter().originalQueue()).isEqualTo(QUEUE);
    assertThat(deadLetter.deadLetter().failureReason()).isEqualTo("still failing");
    assertThat(deadLetter.deadLetter().message().retryCount()).isEqualTo(4);
    assertThat(deadLetter.deadLetter().originalError()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void failedRetryPublishFallsThroughToDeadLetter() throws Exception {
    doThrow(new IOException("channel closed")).when(delayedChannel)
        .basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    DeliverCallback callback = startConsumer(message -> {
      throw new IllegalStateException("boom");
    }, ConsumerOptions.defaults());

    callback.handle("ctag-1", delivery(5, message(0)));

    verify(consumerChannel, never()).basicAck(5, false);
    verify(consumerChannel).basicNack(5, false, false);
    assertThat(events).extracting(QueueEvent::name).contains(QueueEvent.TASK_DEAD_LETTER)
        .doesNotContain(QueueEvent.TASK_RETRY_SCHEDULED);
  }

  @Test
  void nackedRetryPublishFallsThroughToDeadLetter() throws Exception {
    when(connectionManager.awaitPublisherConfirm(delayedChannel)).thenReturn(false);
    DeliverCallback callback = startConsumer(message -> {
      throw new IllegalStateException("boom");
    }, ConsumerOptions.defaults());

    callback.handle("ctag-1", delivery(12, message(0)));

    verify(delayedChannel).basicPublish(eq(TaskQueueTopology.DELAYED_EXCHANGE), eq("task.normal.index"),
        any(AMQP.BasicProperties.class), any(byte[].class));
    verify(consumerChannel, never()).basicAck(12, false);
    verify(consumerChannel).basicNack(12, false, false);
    assertThat(events).extracting(QueueEvent::name).contains(QueueEvent.TASK_DEAD_LETTER)
        .doesNotContain(QueueEvent.TASK_RETRY_SCHEDULED);
  }

  @Test
  void nackedDelayedEnqueueIsSurfacedToTheCaller() throws Exception {
    when(connectionManager.awaitPublisherConfirm(delayedChannel)).thenReturn(false);

    assertThatThrownBy(() -> dispatcher.enqueueTask("report", "payload",
        EnqueueOptions.withPriority(TaskPriority.LOW).delay(Duration.ofSeconds(5))))
        .isInstanceOf(TaskPublishException.class)
        .hasMessageContaining("rejected");
    assertThat(events).isEmpty();
    assertThat(dispatcher.getMessageCounters()).doesNotContainKey("enqueued.low");
  }

  @Test
  void generatedCorrelationIdsAreUniquePerTask() {
    dispatcher.enqueueTask("index", Map.of());
    dispatcher.enqueueTask("index", Map.of());

    ArgumentCaptor<TaskMessage> messages = ArgumentCaptor.forClass(TaskMessage.class);
    verify(connectionManager, times(2)).publishMessage(eq("task.normal.index"), messages.capture(),
        eq(TaskPriority.NORMAL));
    assertThat(messages.getAllValues()).extracting(m -> m.metadata().correlationId()).doesNotHaveDuplicates();
  }

  @Test
  void disabledDeadLetteringStillRejectsSilently() throws Exception {
    DeliverCallback callback = startConsumer(message -> {
      throw new IllegalStateException("NotFoundError: document");
    }, ConsumerOptions.defaults().enableDeadLetter(false));

    callback.handle("ctag-1", delivery(6, message(0)));

    verify(consumerChannel).basicNack(6, false, false);
    assertThat(events).extracting(QueueEvent::name).doesNotContain(QueueEvent.TASK_DEAD_LETTER);
    assertThat(dispatcher.getMessageCounters()).containsEntry("failed." + QUEUE, 1L);
  }

  @Test
  void retriedMessageSucceedsOnSecondDelivery() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    DeliverCallback callback = startConsumer(message -> {
      if (attempts.incrementAndGet() == 1) {
        throw new IllegalStateException("transient");
      }
      return "ok";
    }, ConsumerOptions.defaults().maxRetries(2));

    dispatcher.enqueueTask("index", Map.of("doc", 5), EnqueueOptions.defaults().maxRetries(2));
    ArgumentCaptor<TaskMessage> published = ArgumentCaptor.forClass(TaskMessage.class);
    verify(connectionManager).publishMessage(eq("task.normal.index"), published.capture(), eq(TaskPriority.NORMAL));

    callback.handle("ctag-1", delivery(1, codec.encode(published.getValue())));

    ArgumentCaptor<byte[]> retryBody = ArgumentCaptor.forClass(byte[].class);
    verify(delayedChannel).basicPublish(eq(TaskQueueTopology.DELAYED_EXCHANGE), eq("task.normal.index"),
        any(AMQP.BasicProperties.class), retryBody.capture());
    callback.handle("ctag-1", delivery(2, retryBody.getValue()));

    assertThat(events).filteredOn(e -> e instanceof QueueEvent.TaskRetryScheduled).hasSize(1);
    assertThat(events).filteredOn(e -> e instanceof QueueEvent.TaskProcessingCompleted).hasSize(1);
    assertThat(events).filteredOn(e -> e instanceof QueueEvent.TaskDeadLettered).isEmpty();
    verify(consumerChannel).basicAck(1, false);
    verify(consumerChannel).basicAck(2, false);
  }

  @Test
  void rejectsSecondConsumerForTheSameQueue() throws Exception {
    startConsumer(message -> null, ConsumerOptions.defaults());

    assertThatThrownBy(() -> dispatcher.createConsumer(QUEUE, message -> null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void stopConsumerCancelsAndClosesItsChannel() throws Exception {
    startConsumer(message -> null, ConsumerOptions.defaults());

    dispatcher.stopConsumer(QUEUE);

    verify(consumerChannel).basicCancel("ctag-1");
    verify(consumerChannel).close();
    assertThat(dispatcher.activeConsumers()).isEmpty();
  }

  @Test
  void stopConsumerLogsFailuresAndKeepsTheRegistration() throws Exception {
    doThrow(new IOException("gone")).when(consumerChannel).basicCancel("ctag-1");
    startConsumer(message -> null, ConsumerOptions.defaults());

    dispatcher.stopConsumer(QUEUE);

    assertThat(dispatcher.activeConsumers()).containsExactly(QUEUE);
  }

  @Test
  void stopAllConsumersStopsEveryQueue() throws Exception {
    Channel highChannel = mock(Channel.class);
    when(highChannel.isOpen()).thenReturn(true);
    when(highChannel.basicConsume(eq("tasks.high"), eq(false), any(DeliverCallback.class), any(CancelCallback.class)))
        .thenReturn("ctag-2");
    when(connectionManager.getChannel(ChannelIds.consumer("tasks.high"))).thenReturn(highChannel);
    startConsumer(message -> null, ConsumerOptions.defaults());
    dispatcher.createConsumer("tasks.high", message -> null, ConsumerOptions.defaults().prefetch(5));

    dispatcher.stopAllConsumers();

    verify(consumerChannel).basicCancel("ctag-1");
    verify(highChannel).basicCancel("ctag-2");
    verify(highChannel).basicQos(5);
    assertThat(dispatcher.activeConsumers()).isEmpty();
  }

  @Test
  void reconnectRestoresRegisteredConsumers() throws Exception {
    startConsumer(message -> null, ConsumerOptions.defaults());

    dispatcher.onConnected(true);

    verify(consumerChannel, times(2))
        .basicConsume(eq(QUEUE), eq(false), any(DeliverCallback.class), any(CancelCallback.class));
  }

  @Test
  void metricsRefreshSkipsQueuesWithoutStats() throws Exception {
    DeliverCallback callback = startConsumer(message -> null, ConsumerOptions.defaults());

    dispatcher.refreshQueueMetrics();
    verify(connectionManager, never()).getQueueInfo(anyString());

    callback.handle("ctag-1", delivery(1, message(0)));
    callback.handle("ctag-1", delivery(2, message(0)));
    when(connectionManager.getQueueInfo(QUEUE)).thenReturn(new QueueInfo(QUEUE, 17, 2));
    clock.advance(Duration.ofSeconds(4));
    dispatcher.refreshQueueMetrics();

    QueueHealthStats stats = dispatcher.getQueueHealth(QUEUE).get(0);
    assertThat(stats.messageCount()).isEqualTo(17);
    assertThat(stats.consumerCount()).isEqualTo(2);
    assertThat(stats.throughputPerSecond()).isEqualTo(0.5);
  }

  @Test
  void queueHealthWithoutNameReturnsEveryQueue() throws Exception {
    DeliverCallback callback = startConsumer(message -> null, ConsumerOptions.defaults());
    callback.handle("ctag-1", delivery(1, message(0)));

    assertThat(dispatcher.getQueueHealth()).extracting(QueueHealthStats::queueName).containsExactly(QUEUE);
    assertThat(dispatcher.getQueueHealth("tasks.low")).isEmpty();
  }

  private DeliverCallback startConsumer(TaskProcessor processor, ConsumerOptions options) throws IOException {
    dispatcher.createConsumer(QUEUE, processor, options);
    ArgumentCaptor<DeliverCallback> callback = ArgumentCaptor.forClass(DeliverCallback.class);
    verify(consumerChannel).basicConsume(eq(QUEUE), eq(false), callback.capture(), any(CancelCallback.class));
    return callback.getValue();
  }

  private byte[] message(int retryCount) {
    TaskMessage message = new TaskMessage("m-1", codec.toPayload(Map.of("doc", 1)),
        new MessageMetadata("m-1", "c-1", START, retryCount, 3, TaskPriority.NORMAL, "task.normal.index"), START);
    return codec.encode(message);
  }

  private static Delivery delivery(long tag, byte[] body) {
    return new Delivery(new Envelope(tag, false, TaskQueueTopology.PROCESSING_EXCHANGE, "task.normal.index"),
        new AMQP.BasicProperties(), body);
  }
}
