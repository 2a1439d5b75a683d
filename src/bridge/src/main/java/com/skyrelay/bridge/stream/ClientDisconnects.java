package com.skyrelay.bridge.stream;

import java.io.EOFException;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tells a push client that went away apart from a sink that actually broke.
 *
 * <p>Servlet containers report a closed browser tab through their own exception types, usually
 * wrapped once or twice by Spring, so the whole cause chain is inspected.
 */
final class ClientDisconnects {
  private static final List<String> CONTAINER_TYPES = List.of(
      "ClientAbortException",
      "EofException",
      "AsyncRequestNotUsableException");
  private static final List<String> SOCKET_MESSAGES = List.of(
      "broken pipe",
      "connection reset",
      "connection abort",
      "socket closed",
      "stream closed",
      "forcibly closed");

  private ClientDisconnects() {}

  static boolean isClientGone(Throwable error) {
    for (Throwable cause : causes(error)) {
      if (cause instanceof EOFException || cause instanceof ClosedChannelException) {
        return true;
      }
      String type = cause.getClass().getSimpleName();
      if (CONTAINER_TYPES.stream().anyMatch(type::endsWith)) {
        return true;
      }
      String message = cause.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (SOCKET_MESSAGES.stream().anyMatch(lower::contains)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Innermost cause as {@code Type: message}, for one-line debug logs. */
  static String describe(Throwable error) {
    List<Throwable> chain = causes(error);
    Throwable root = chain.get(chain.size() - 1);
    String message = root.getMessage();
    return message == null || message.isBlank()
        ? root.getClass().getSimpleName()
        : root.getClass().getSimpleName() + ": " + message;
  }

  // Cause chains can loop through initCause, hence the identity set.
  private static List<Throwable> causes(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
      chain.add(current);
    }
    return chain;
  }
}
