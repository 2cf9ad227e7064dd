package io.taskhive.queue.dispatch;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a processing failure is permanent, in which case the message is dead-lettered without retry.
 */
@FunctionalInterface
public interface PermanentErrorClassifier {

  List<String> DEFAULT_MARKERS =
      List.of("ValidationError", "AuthenticationError", "AuthorizationError", "NotFoundError");

  boolean isPermanentError(Throwable error);

  default PermanentErrorClassifier or(PermanentErrorClassifier other) {
    Objects.requireNonNull(other, "other");
    return error -> isPermanentError(error) || other.isPermanentError(error);
  }

  static PermanentErrorClassifier defaults() {
    return denyList(DEFAULT_MARKERS);
  }

  /**
   * Matches the simple class name and the message of every throwable in the cause chain against the markers.
   */
  static PermanentErrorClassifier denyList(Collection<String> markers) {
    List<String> copy = List.copyOf(Objects.requireNonNull(markers, "markers"));
    return error -> {
      Throwable current = error;
      while (current != null) {
        String name = current.getClass().getSimpleName();
        String message = current.getMessage();
        for (String marker : copy) {
          if (name.contains(marker) || (message != null && message.contains(marker))) {
            return true;
          }
        }
        if (current.getCause() == current) {
          break;
        }
        current = current.getCause();
      }
      return false;
    };
  }
}
