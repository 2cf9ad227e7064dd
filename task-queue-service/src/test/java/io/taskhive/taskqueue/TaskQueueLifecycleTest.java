package io.taskhive.taskqueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.taskhive.queue.connection.ConnectionFatalException;
import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.connection.DelayedDeliveryMode;
import io.taskhive.queue.dispatch.DelayedMessageRelay;
import io.taskhive.queue.dispatch.TaskDispatcher;
import io.taskhive.queue.health.HealthMonitor;
import io.taskhive.taskqueue.config.TaskQueueProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskQueueLifecycleTest {

  @Mock
  private ConnectionManager connectionManager;

  @Mock
  private TaskDispatcher dispatcher;

  @Mock
  private HealthMonitor healthMonitor;

  @Mock
  private DelayedMessageRelay relay;

  @Test
  void registersRecoveryListenersOnCreation() {
    lifecycle(DelayedDeliveryMode.REPUBLISH);

    verify(connectionManager).addConnectionStateListener(dispatcher);
    verify(connectionManager).addConnectionStateListener(relay);
  }

  @Test
  void startConnectsBeforeStartingSchedules() {
    TaskQueueLifecycle lifecycle = lifecycle(DelayedDeliveryMode.REPUBLISH);

    lifecycle.start();

    InOrder order = inOrder(connectionManager, dispatcher, healthMonitor, relay);
    order.verify(connectionManager).initialize();
    order.verify(dispatcher).start();
    order.verify(healthMonitor).start();
    order.verify(relay).start();
    assertThat(lifecycle.isRunning()).isTrue();
  }

  @Test
  void pluginModeDoesNotRunTheRelay() {
    TaskQueueLifecycle lifecycle = lifecycle(DelayedDeliveryMode.PLUGIN);

    lifecycle.start();

    verify(relay, never()).start();
  }

  @Test
  void fatalConnectionFailureAbortsStartup() {
    doThrow(new ConnectionFatalException("gave up", null)).when(connectionManager).initialize();
    TaskQueueLifecycle lifecycle = lifecycle(DelayedDeliveryMode.REPUBLISH);

    assertThatThrownBy(lifecycle::start).isInstanceOf(ConnectionFatalException.class);

    assertThat(lifecycle.isRunning()).isFalse();
    verify(dispatcher, never()).start();
  }

  @Test
  void stopTearsDownInReverseAndRunsCallback() {
    TaskQueueLifecycle lifecycle = lifecycle(DelayedDeliveryMode.REPUBLISH);
    lifecycle.start();
    boolean[] called = new boolean[1];

    lifecycle.stop(() -> called[0] = true);

    InOrder order = inOrder(healthMonitor, dispatcher, relay, connectionManager);
    order.verify(healthMonitor).stop();
    order.verify(dispatcher).stopAllConsumers();
    order.verify(relay).stop();
    order.verify(connectionManager).disconnect();
    assertThat(called[0]).isTrue();
    assertThat(lifecycle.isRunning()).isFalse();
  }

  @Test
  void stopBeforeStartIsNoop() {
    TaskQueueLifecycle lifecycle = lifecycle(DelayedDeliveryMode.REPUBLISH);

    lifecycle.stop();

    verify(connectionManager, never()).disconnect();
  }

  private TaskQueueLifecycle lifecycle(DelayedDeliveryMode mode) {
    TaskQueueProperties.Rabbit rabbit = new TaskQueueProperties.Rabbit(null, null, null, null, null, null, null, null,
        null, null, null, null, mode, null);
    TaskQueueProperties properties = new TaskQueueProperties(null, rabbit, null, null);
    return new TaskQueueLifecycle(connectionManager, dispatcher, healthMonitor, relay, properties);
  }
}
